package com.analyseloto.stats.service;

import com.analyseloto.stats.dto.FoldResult;

@FunctionalInterface
public interface FoldProgressListener {

    FoldProgressListener NONE = (fold, completed, total) -> { };

    /**
     * Appelé après chaque pli, dans l'ordre des plis.
     */
    void onFoldCompleted(FoldResult fold, int completed, int total);
}

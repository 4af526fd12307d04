package com.analyseloto.stats.repository;

import com.analyseloto.stats.model.Draw;

import java.util.List;

/**
 * Source des tirages historiques. Le moteur ne fait que lire.
 */
public interface SequenceStore {

    /**
     * Tous les tirages, du plus ancien au plus récent
     * @return liste chronologique, jamais null
     */
    List<Draw> getDraws();

    /**
     * Tirages filtrés, du plus ancien au plus récent
     * @param filter critères de sélection
     * @return liste chronologique, jamais null
     */
    List<Draw> getDraws(DrawFilter filter);
}

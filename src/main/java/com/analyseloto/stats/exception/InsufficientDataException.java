package com.analyseloto.stats.exception;

import lombok.Getter;

/**
 * Pas assez de tirages pour l'opération demandée.
 * Seule la validation croisée la lève : les autres calculs renvoient un résultat neutre.
 */
@Getter
public class InsufficientDataException extends RuntimeException {
    private final int available;
    private final int required;

    public InsufficientDataException(int available, int required, String message) {
        super(message);
        this.available = available;
        this.required = required;
    }
}

package com.analyseloto.stats.exception;

/**
 * Combinaison d'arité incorrecte ou contenant une valeur hors plage.
 * Erreur d'appel : c'est à l'appelant de valider avant d'appeler.
 */
public class InvalidCombinationFormatException extends RuntimeException {
    public InvalidCombinationFormatException(String message) {
        super(message);
    }
}

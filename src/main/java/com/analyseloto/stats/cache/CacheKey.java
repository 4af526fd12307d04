package com.analyseloto.stats.cache;

import com.analyseloto.stats.enums.ComputationKind;
import com.analyseloto.stats.util.Constantes;
import lombok.Value;

/**
 * Clé déterministe : type de calcul + paramètres sérialisés.
 */
@Value
public class CacheKey {
    ComputationKind kind;
    String parameters;

    public String asString() {
        return kind.getPrefix() + Constantes.CACHE_KEY_SEPARATOR + parameters;
    }

    @Override
    public String toString() {
        return asString();
    }
}

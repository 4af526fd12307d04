package com.analyseloto.stats.model;

import com.analyseloto.stats.exception.InvalidCombinationFormatException;
import lombok.EqualsAndHashCode;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Format d'un jeu : nombre de positions et plage de valeurs de chacune.
 * Les plages peuvent différer d'une position à l'autre.
 */
@EqualsAndHashCode
public final class GameFormat {

    private static final Pattern RANGE_PATTERN = Pattern.compile("\\s*(-?\\d+)\\s*-\\s*(-?\\d+)\\s*");

    private final List<PositionRange> ranges;

    public GameFormat(List<PositionRange> ranges) {
        if (ranges == null || ranges.isEmpty()) {
            throw new IllegalArgumentException("Un format de jeu doit avoir au moins une position");
        }
        this.ranges = List.copyOf(ranges);
    }

    /**
     * Format où toutes les positions partagent la même plage (ex: Pick 3 = 3 positions de 0 à 9).
     */
    public static GameFormat uniform(int positions, int min, int max) {
        List<PositionRange> list = new ArrayList<>(positions);
        for (int i = 0; i < positions; i++) list.add(new PositionRange(min, max));
        return new GameFormat(list);
    }

    /**
     * Format décrit par une liste de plages "min-max" séparées par des virgules (ex: "1-49,1-49,1-10").
     */
    public static GameFormat parse(String definition) {
        if (definition == null || definition.isBlank()) {
            throw new IllegalArgumentException("Définition de format vide");
        }
        List<PositionRange> list = new ArrayList<>();
        for (String part : definition.split(",")) {
            Matcher m = RANGE_PATTERN.matcher(part);
            if (!m.matches()) {
                throw new IllegalArgumentException("Plage illisible : '" + part.trim() + "' (attendu min-max)");
            }
            list.add(new PositionRange(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2))));
        }
        return new GameFormat(list);
    }

    public int getPositions() {
        return ranges.size();
    }

    public PositionRange range(int position) {
        checkPosition(position);
        return ranges.get(position);
    }

    public void checkPosition(int position) {
        if (position < 0 || position >= ranges.size()) {
            throw new IllegalArgumentException("Position " + position + " hors format (0.." + (ranges.size() - 1) + ")");
        }
    }

    /**
     * Taille de l'espace des combinaisons ordonnées (produit des tailles de plages).
     */
    public long combinationSpaceSize() {
        long total = 1L;
        for (PositionRange r : ranges) total = Math.multiplyExact(total, r.size());
        return total;
    }

    /**
     * Vérifie l'arité et les bornes d'une combinaison.
     * @throws InvalidCombinationFormatException si la combinaison ne respecte pas le format
     */
    public void validate(List<Integer> combination) {
        if (combination == null || combination.size() != ranges.size()) {
            throw new InvalidCombinationFormatException(
                    "Arité invalide : attendu " + ranges.size() + " valeurs, reçu "
                            + (combination == null ? "null" : combination.size()));
        }
        for (int i = 0; i < combination.size(); i++) {
            Integer v = combination.get(i);
            if (v == null || !ranges.get(i).contains(v)) {
                throw new InvalidCombinationFormatException(
                        "Valeur " + v + " hors plage pour la position " + i + " " + describe(ranges.get(i)));
            }
        }
    }

    public String describe() {
        return ranges.stream().map(GameFormat::describe).collect(Collectors.joining(","));
    }

    private static String describe(PositionRange r) {
        return "[" + r.getMin() + "-" + r.getMax() + "]";
    }

    @Override
    public String toString() {
        return "GameFormat" + describe();
    }
}

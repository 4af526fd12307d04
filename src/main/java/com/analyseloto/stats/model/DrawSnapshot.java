package com.analyseloto.stats.model;

import lombok.Getter;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.List;

/**
 * Photographie immuable de l'historique : liste chronologique (du plus ancien au plus récent)
 * des tirages, accompagnée du format de jeu.
 * <p>
 * C'est l'objet de contexte passé explicitement à tous les calculs ; son empreinte sert
 * d'identité dans les clés du cache de résultats.
 */
@Getter
public final class DrawSnapshot {

    private final GameFormat format;
    private final List<Draw> draws;
    private final String fingerprint;

    private DrawSnapshot(GameFormat format, List<Draw> draws) {
        this.format = format;
        this.draws = draws;
        this.fingerprint = format.describe() + "#" + draws.size() + "#" + contentDigest(draws);
    }

    /**
     * SHA-256 de la suite "date:valeurs" de tous les tirages.
     */
    private static String contentDigest(List<Draw> draws) {
        MessageDigest digest;
        try {
            digest = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 indisponible", e);
        }
        for (Draw d : draws) {
            digest.update((d.getDate() + ":" + d.getValues() + ";").getBytes(StandardCharsets.UTF_8));
        }
        return HexFormat.of().formatHex(digest.digest());
    }

    /**
     * Construit un snapshot validé et trié par date (tri stable).
     */
    public static DrawSnapshot of(GameFormat format, List<Draw> draws) {
        List<Draw> sorted = new ArrayList<>(draws);
        sorted.sort(Comparator.comparing(Draw::getDate));
        for (Draw d : sorted) format.validate(d.getValues());
        return new DrawSnapshot(format, List.copyOf(sorted));
    }

    public int size() {
        return draws.size();
    }

    public boolean isEmpty() {
        return draws.isEmpty();
    }

    public Draw get(int index) {
        return draws.get(index);
    }

    public Draw lastDraw() {
        return draws.isEmpty() ? null : draws.get(draws.size() - 1);
    }

    /**
     * Séquence chronologique des valeurs d'une position.
     */
    public int[] valuesAt(int position) {
        format.checkPosition(position);
        int[] result = new int[draws.size()];
        for (int i = 0; i < draws.size(); i++) result[i] = draws.get(i).valueAt(position);
        return result;
    }

    /**
     * Nouveau snapshot sur une sous-liste de tirages, même format.
     */
    public DrawSnapshot withDraws(List<Draw> subset) {
        return new DrawSnapshot(format, List.copyOf(subset));
    }
}

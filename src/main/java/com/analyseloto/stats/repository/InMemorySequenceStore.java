package com.analyseloto.stats.repository;

import com.analyseloto.stats.model.Draw;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Stockage en mémoire des tirages. Le chargement (import, scraping...) est à la charge de l'appelant.
 */
@Slf4j
@Repository
public class InMemorySequenceStore implements SequenceStore {

    private final List<Draw> draws = new CopyOnWriteArrayList<>();

    public void add(Draw draw) {
        draws.add(draw);
    }

    public void addAll(Collection<Draw> newDraws) {
        draws.addAll(newDraws);
        log.info("📥 {} tirage(s) ajouté(s), total = {}", newDraws.size(), draws.size());
    }

    public void replaceAll(Collection<Draw> newDraws) {
        draws.clear();
        draws.addAll(newDraws);
        log.info("🔄 Historique remplacé : {} tirage(s)", draws.size());
    }

    public boolean existsByDate(LocalDate date) {
        return draws.stream().anyMatch(d -> d.getDate().equals(date));
    }

    public int count() {
        return draws.size();
    }

    @Override
    public List<Draw> getDraws() {
        return getDraws(DrawFilter.none());
    }

    @Override
    public List<Draw> getDraws(DrawFilter filter) {
        List<Draw> result = new ArrayList<>();
        for (Draw d : draws) {
            if (filter.matches(d)) result.add(d);
        }
        result.sort(Comparator.comparing(Draw::getDate));
        return result;
    }
}

package com.analyseloto.stats;

import com.analyseloto.stats.model.GameFormat;
import com.analyseloto.stats.model.PositionRange;
import com.analyseloto.stats.service.StatsEngineService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class StatsEngineApplicationTests {

	@Autowired
	private StatsEngineService statsEngineService;

	@Autowired
	private GameFormat gameFormat;

	@Test
	void contextLoads() {
		// Si le test arrive ici, c'est que Spring a réussi à démarrer !
		assertThat(statsEngineService.getCacheStats().getMaxSize()).isEqualTo(50);
		// Plages par position prioritaires sur positions/min/max
		assertThat(gameFormat.getPositions()).isEqualTo(3);
		assertThat(gameFormat.range(2)).isEqualTo(new PositionRange(1, 5));
	}

}

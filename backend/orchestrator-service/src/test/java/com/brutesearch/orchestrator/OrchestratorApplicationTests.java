package com.brutesearch.orchestrator;

import com.brutesearch.orchestrator.service.fetch.TieredFetchChain;
import com.brutesearch.orchestrator.service.source.SourceRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 스프링 컨텍스트 로드 테스트
 * 애플리케이션 설정이 올바르게 구성되었는지 확인합니다.
 */
@SpringBootTest
@ActiveProfiles("test")
class OrchestratorApplicationTests {

    @Autowired
    private TieredFetchChain tieredFetchChain;

    @Autowired
    private SourceRegistry sourceRegistry;

    @Test
    void contextLoads() {
        // test 프로필은 direct 단계만 활성화
        assertThat(tieredFetchChain.tierNames()).containsExactly("direct");
        assertThat(sourceRegistry.isEmpty()).isTrue();
    }
}

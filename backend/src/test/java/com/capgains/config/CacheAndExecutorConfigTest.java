package com.capgains.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.cache.CacheManager;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(classes = {
        CaffeineConfig.class,
        AsyncConfig.class,
        FxConfig.class
})
class CacheAndExecutorConfigTest {

    @Autowired
    CacheManager cacheManager;

    @Autowired
    @Qualifier(AsyncConfig.REPLAY_EXECUTOR)
    Executor replayExecutor;

    @Autowired
    TaxProperties taxProperties;

    @Autowired
    FxProperties fxProperties;

    @Test
    @DisplayName("exchange rate cache is created and usable")
    void cacheCreatedAndUsed() {
        assertThat(cacheManager.getCache(CaffeineConfig.EXCHANGE_RATE_CACHE)).isNotNull();

        cacheManager.getCache(CaffeineConfig.EXCHANGE_RATE_CACHE).put("key1", "value1");
        assertThat(cacheManager.getCache(CaffeineConfig.EXCHANGE_RATE_CACHE).get("key1").get()).isEqualTo("value1");
    }

    @Test
    @DisplayName("replay executor is a fixed pool of 4 named replay-")
    void replayExecutorCreated() {
        assertThat(replayExecutor).isInstanceOf(ThreadPoolTaskExecutor.class);
        ThreadPoolTaskExecutor e = (ThreadPoolTaskExecutor) replayExecutor;
        assertThat(e.getCorePoolSize()).isEqualTo(4);
        assertThat(e.getMaxPoolSize()).isEqualTo(4);
        assertThat(e.getThreadNamePrefix()).isEqualTo("replay-");
    }

    @Test
    @DisplayName("property defaults: CNY at 20%, nearby window 7 days, fallback off")
    void propertyDefaults() {
        assertThat(taxProperties.getBaseCurrency()).isEqualTo("CNY");
        assertThat(taxProperties.getTaxRate()).isEqualByComparingTo("0.20");
        assertThat(fxProperties.getNearbyLookbackDays()).isEqualTo(7);
        assertThat(fxProperties.isFallbackEnabled()).isFalse();
        assertThat(fxProperties.getFrankfurter().isEnabled()).isTrue();
    }
}

package com.giftbattle.backend.config;

import com.giftbattle.backend.service.loot.RandomSource;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class EconomyConfig {

    @Bean
    public RandomSource randomSource() {
        return RandomSource.threadLocal();
    }
}

package ru.vavtech.leavetracker.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import ru.vavtech.leavetracker.service.LeaveBalanceLedger;

import java.time.Clock;

/**
 * Конфигурация сервиса учета отпусков.
 * Загружает начальные остатки при старте приложения.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class LeaveConfiguration {

    private final LeaveBalanceLedger balanceLedger;

    /**
     * Часы для отметок времени заявок, в тестах подменяются фиксированными
     */
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public CommandLineRunner initializeLedger() {
        return args -> {
            log.info("Загрузка остатков отпусков...");
            balanceLedger.initializeBalances();
            log.info("Сервис учета отпусков готов к работе");
        };
    }
}

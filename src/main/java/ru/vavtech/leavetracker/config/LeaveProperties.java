package ru.vavtech.leavetracker.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import ru.vavtech.leavetracker.model.LeaveType;

import java.util.HashMap;
import java.util.Map;

/**
 * Настройки учета отпусков.
 * <p>
 * Начальные остатки задаются в application.yml:
 * <pre>
 * leave:
 *   initial-balances:
 *     E1:
 *       ANNUAL: 10
 * </pre>
 */
@Setter
@Getter
@Configuration
@ConfigurationProperties(prefix = "leave")
public class LeaveProperties {

    /**
     * ID сотрудника -> вид отпуска -> количество дней
     */
    private Map<String, Map<LeaveType, Long>> initialBalances = new HashMap<>();
}

package ru.vavtech.leavetracker.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Принятая заявка на отпуск.
 * Создается только после успешного списания дней и больше не изменяется.
 */
@Value
@Builder
public class LeaveRequest {

    /**
     * Уникальный идентификатор заявки, назначается при принятии
     */
    String requestId;

    String employeeId;

    LeaveType leaveType;

    LocalDate startDate;

    LocalDate endDate;

    /**
     * Количество списанных дней (обе границы включительно)
     */
    long days;

    Status status;

    /**
     * Время создания заявки
     */
    LocalDateTime createdAt;

    public BalanceKey balanceKey() {
        return new BalanceKey(employeeId, leaveType);
    }

    /**
     * Статусы заявки. Сохраняются только заявки в статусе ACCEPTED.
     */
    public enum Status {
        PENDING,
        ACCEPTED,
        REJECTED
    }
}

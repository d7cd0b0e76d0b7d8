package ru.vavtech.leavetracker.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * Результат подачи заявки на отпуск.
 * При успехе содержит идентификатор заявки и подтверждение, при отказе - причину.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SubmissionResult {

    /**
     * Статус операции подачи заявки
     */
    Status status;

    /**
     * ID принятой заявки (только при успехе)
     */
    String requestId;

    /**
     * Сообщение для клиента: подтверждение или описание ошибки
     */
    String message;

    String employeeId;

    LeaveType leaveType;

    /**
     * Запрошенное количество дней (null, если до подсчета дело не дошло)
     */
    Long requestedDays;

    /**
     * Остаток дней после списания (только при успехе)
     */
    Long remainingBalance;

    /**
     * Время операции
     */
    LocalDateTime timestamp;

    @JsonIgnore
    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    /**
     * Статусы подачи заявки
     */
    public enum Status {
        SUCCESS("Заявка принята"),
        INVALID_DATE_RANGE("Дата окончания раньше даты начала"),
        INSUFFICIENT_BALANCE("Недостаточно дней отпуска"),
        UNKNOWN_EMPLOYEE("Нет данных об остатке отпуска сотрудника");

        private final String description;

        Status(String description) {
            this.description = description;
        }

        public String getDescription() {
            return description;
        }
    }
}

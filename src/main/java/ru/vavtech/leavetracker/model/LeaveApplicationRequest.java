package ru.vavtech.leavetracker.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;

/**
 * Заявка на отпуск в том виде, в котором она приходит от клиента.
 * Наличие полей и формат дат проверяются на границе API, бизнес-правила применяет
 * {@link ru.vavtech.leavetracker.service.LeaveRequestService}.
 */
@Value
@Builder
@Jacksonized
public class LeaveApplicationRequest {

    @NotBlank(message = "ID сотрудника обязателен")
    String employeeId;

    @NotNull(message = "Вид отпуска обязателен")
    LeaveType leaveType;

    @NotNull(message = "Дата начала обязательна")
    LocalDate startDate;

    @NotNull(message = "Дата окончания обязательна")
    LocalDate endDate;
}

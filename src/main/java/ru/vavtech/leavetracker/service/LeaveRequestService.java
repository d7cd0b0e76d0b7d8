package ru.vavtech.leavetracker.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import ru.vavtech.leavetracker.exception.InsufficientBalanceException;
import ru.vavtech.leavetracker.exception.LeaveRequestNotFoundException;
import ru.vavtech.leavetracker.exception.UnknownEmployeeException;
import ru.vavtech.leavetracker.model.LeaveApplicationRequest;
import ru.vavtech.leavetracker.model.LeaveRequest;
import ru.vavtech.leavetracker.model.SubmissionResult;
import ru.vavtech.leavetracker.repository.LeaveRequestRepository;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.UUID;

/**
 * Сервис подачи заявок на отпуск.
 * <p>
 * Правила проверяются в фиксированном порядке, первое нарушенное определяет результат:
 * 1. Дата окончания не раньше даты начала
 * 2. Подсчет дней: обе границы включительно, заявка на один день = 1 день
 * 3. Списание дней из {@link LeaveBalanceLedger}
 * 4. Сохранение принятой заявки
 * <p>
 * Отклоненная заявка не списывает дни и не сохраняется. Если после списания не удалось
 * сохранить заявку, дни возвращаются в журнал, а ошибка хранилища пробрасывается дальше.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LeaveRequestService {

    public static final String CONFIRMATION_MESSAGE = "Leave request submitted successfully.";

    private final LeaveBalanceLedger balanceLedger;
    private final LeaveRequestRepository leaveRequestRepository;
    private final Clock clock;

    /**
     * Подача заявки на отпуск.
     *
     * @param request заявка с уже проверенным наличием полей
     * @return подтверждение с ID заявки или причина отказа
     */
    public SubmissionResult submit(LeaveApplicationRequest request) {
        log.info("Заявка на отпуск {} с {} по {} от сотрудника {}",
                request.getLeaveType(), request.getStartDate(), request.getEndDate(), request.getEmployeeId());

        // Шаг 1: порядок дат
        if (request.getEndDate().isBefore(request.getStartDate())) {
            log.warn("Дата окончания {} раньше даты начала {} у сотрудника {}",
                    request.getEndDate(), request.getStartDate(), request.getEmployeeId());
            return createErrorResult(request, SubmissionResult.Status.INVALID_DATE_RANGE, null,
                    "Дата окончания отпуска не может быть раньше даты начала");
        }

        // Шаг 2: количество дней
        long days = countDays(request.getStartDate(), request.getEndDate());

        // Шаг 3: списание
        long remaining;
        try {
            remaining = balanceLedger.debit(request.getEmployeeId(), request.getLeaveType(), days);
        } catch (InsufficientBalanceException e) {
            log.warn("Отказ: {}", e.getMessage());
            return createErrorResult(request, SubmissionResult.Status.INSUFFICIENT_BALANCE, days,
                    "Недостаточно дней отпуска: запрошено " + days + ", доступно " + e.getAvailableDays());
        } catch (UnknownEmployeeException e) {
            log.warn("Отказ: {}", e.getMessage());
            return createErrorResult(request, SubmissionResult.Status.UNKNOWN_EMPLOYEE, days, e.getMessage());
        }

        // Шаг 4: сохранение
        LeaveRequest leaveRequest = LeaveRequest.builder()
                .requestId(generateRequestId())
                .employeeId(request.getEmployeeId())
                .leaveType(request.getLeaveType())
                .startDate(request.getStartDate())
                .endDate(request.getEndDate())
                .days(days)
                .status(LeaveRequest.Status.ACCEPTED)
                .createdAt(LocalDateTime.now(clock))
                .build();

        try {
            leaveRequestRepository.insert(leaveRequest);
        } catch (RuntimeException e) {
            log.error("Не удалось сохранить заявку {}, возвращаем {} дн. сотруднику {}",
                    leaveRequest.getRequestId(), days, request.getEmployeeId(), e);
            rollbackDebit(leaveRequest, e);
            throw e;
        }

        log.info("Заявка {} принята: {} дн. {} для сотрудника {}, остаток {}",
                leaveRequest.getRequestId(), days, request.getLeaveType(), request.getEmployeeId(), remaining);

        return SubmissionResult.builder()
                .status(SubmissionResult.Status.SUCCESS)
                .requestId(leaveRequest.getRequestId())
                .message(CONFIRMATION_MESSAGE)
                .employeeId(request.getEmployeeId())
                .leaveType(request.getLeaveType())
                .requestedDays(days)
                .remainingBalance(remaining)
                .timestamp(leaveRequest.getCreatedAt())
                .build();
    }

    public LeaveRequest findRequest(String requestId) {
        return leaveRequestRepository.findById(requestId)
                .orElseThrow(() -> new LeaveRequestNotFoundException(requestId));
    }

    public List<LeaveRequest> findRequestsByEmployee(String employeeId) {
        return leaveRequestRepository.findByEmployeeId(employeeId);
    }

    /**
     * Количество календарных дней отпуска, обе даты включительно
     */
    static long countDays(LocalDate startDate, LocalDate endDate) {
        return ChronoUnit.DAYS.between(startDate, endDate) + 1;
    }

    /**
     * Возврат списанных дней, если заявку не удалось сохранить
     */
    private void rollbackDebit(LeaveRequest leaveRequest, RuntimeException cause) {
        try {
            balanceLedger.credit(leaveRequest.getEmployeeId(), leaveRequest.getLeaveType(), leaveRequest.getDays());
            log.warn("Списание по заявке {} отменено", leaveRequest.getRequestId());
        } catch (RuntimeException rollbackError) {
            log.error("Не удалось вернуть {} дн. по {}: остаток требует ручной проверки",
                    leaveRequest.getDays(), leaveRequest.balanceKey(), rollbackError);
            cause.addSuppressed(rollbackError);
        }
    }

    private String generateRequestId() {
        return "LR-" + UUID.randomUUID().toString().replace("-", "").substring(0, 16).toUpperCase();
    }

    private SubmissionResult createErrorResult(LeaveApplicationRequest request,
                                               SubmissionResult.Status status,
                                               Long requestedDays,
                                               String message) {
        return SubmissionResult.builder()
                .status(status)
                .message(message)
                .employeeId(request.getEmployeeId())
                .leaveType(request.getLeaveType())
                .requestedDays(requestedDays)
                .timestamp(LocalDateTime.now(clock))
                .build();
    }
}

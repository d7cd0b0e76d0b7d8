package ru.vavtech.leavetracker.controller;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import ru.vavtech.leavetracker.model.LeaveApplicationRequest;
import ru.vavtech.leavetracker.model.LeaveRequest;
import ru.vavtech.leavetracker.model.LeaveType;
import ru.vavtech.leavetracker.model.SubmissionResult;
import ru.vavtech.leavetracker.service.LeaveBalanceLedger;
import ru.vavtech.leavetracker.service.LeaveRequestService;

import java.util.List;
import java.util.Map;

/**
 * REST контроллер подачи заявок на отпуск и просмотра остатков.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/leave")
@RequiredArgsConstructor
public class LeaveController {

    private final LeaveRequestService leaveRequestService;
    private final LeaveBalanceLedger balanceLedger;

    /**
     * Подача заявки на отпуск
     */
    @PostMapping("/apply")
    public ResponseEntity<SubmissionResult> apply(@RequestBody @Valid LeaveApplicationRequest request) {
        SubmissionResult result = leaveRequestService.submit(request);

        HttpStatus status = switch (result.getStatus()) {
            case SUCCESS -> HttpStatus.CREATED;
            case INVALID_DATE_RANGE -> HttpStatus.BAD_REQUEST;
            case INSUFFICIENT_BALANCE -> HttpStatus.UNPROCESSABLE_ENTITY;
            case UNKNOWN_EMPLOYEE -> HttpStatus.NOT_FOUND;
        };

        return ResponseEntity.status(status).body(result);
    }

    /**
     * Остатки отпусков сотрудника по видам
     */
    @GetMapping("/balance/{employeeId}")
    public ResponseEntity<Map<LeaveType, Long>> getBalances(@PathVariable String employeeId) {
        return ResponseEntity.ok(balanceLedger.getBalances(employeeId));
    }

    @GetMapping("/requests/{requestId}")
    public ResponseEntity<LeaveRequest> getRequest(@PathVariable String requestId) {
        return ResponseEntity.ok(leaveRequestService.findRequest(requestId));
    }

    /**
     * Принятые заявки сотрудника, новые первыми
     */
    @GetMapping("/requests")
    public ResponseEntity<List<LeaveRequest>> getRequests(@RequestParam String employeeId) {
        log.debug("Запрос списка заявок сотрудника {}", employeeId);
        return ResponseEntity.ok(leaveRequestService.findRequestsByEmployee(employeeId));
    }

    /**
     * Проверка работоспособности сервиса
     */
    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}

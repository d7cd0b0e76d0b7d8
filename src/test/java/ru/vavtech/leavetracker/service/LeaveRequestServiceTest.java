package ru.vavtech.leavetracker.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import ru.vavtech.leavetracker.exception.InsufficientBalanceException;
import ru.vavtech.leavetracker.exception.LeaveRequestNotFoundException;
import ru.vavtech.leavetracker.exception.UnknownEmployeeException;
import ru.vavtech.leavetracker.model.BalanceKey;
import ru.vavtech.leavetracker.model.LeaveApplicationRequest;
import ru.vavtech.leavetracker.model.LeaveRequest;
import ru.vavtech.leavetracker.model.LeaveType;
import ru.vavtech.leavetracker.model.SubmissionResult;
import ru.vavtech.leavetracker.repository.LeaveRequestRepository;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit тесты сервиса подачи заявок на отпуск
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("Тесты сервиса подачи заявок на отпуск")
class LeaveRequestServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-20T09:30:00Z");

    @Mock
    private LeaveBalanceLedger balanceLedger;

    @Mock
    private LeaveRequestRepository leaveRequestRepository;

    private LeaveRequestService leaveRequestService;

    @BeforeEach
    void setUp() {
        leaveRequestService = new LeaveRequestService(balanceLedger, leaveRequestRepository,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static LeaveApplicationRequest request(String start, String end) {
        return LeaveApplicationRequest.builder()
                .employeeId("E1")
                .leaveType(LeaveType.ANNUAL)
                .startDate(LocalDate.parse(start))
                .endDate(LocalDate.parse(end))
                .build();
    }

    @Test
    @DisplayName("Успешная подача заявки")
    void submit_Success() {
        // Given
        when(balanceLedger.debit("E1", LeaveType.ANNUAL, 3)).thenReturn(7L);
        when(leaveRequestRepository.insert(any(LeaveRequest.class))).thenAnswer(inv -> inv.getArgument(0));

        // When
        SubmissionResult result = leaveRequestService.submit(request("2024-06-01", "2024-06-03"));

        // Then
        assertThat(result.getStatus()).isEqualTo(SubmissionResult.Status.SUCCESS);
        assertThat(result.getRequestId()).isNotNull().startsWith("LR-").hasSize(19);
        assertThat(result.getMessage()).isEqualTo("Leave request submitted successfully.");
        assertThat(result.getRequestedDays()).isEqualTo(3);
        assertThat(result.getRemainingBalance()).isEqualTo(7);

        // Проверяем сохраненную заявку
        ArgumentCaptor<LeaveRequest> captor = ArgumentCaptor.forClass(LeaveRequest.class);
        verify(leaveRequestRepository).insert(captor.capture());
        LeaveRequest saved = captor.getValue();
        assertThat(saved.getRequestId()).isEqualTo(result.getRequestId());
        assertThat(saved.getStatus()).isEqualTo(LeaveRequest.Status.ACCEPTED);
        assertThat(saved.getDays()).isEqualTo(3);
        assertThat(saved.getCreatedAt()).isEqualTo(LocalDateTime.of(2024, 5, 20, 9, 30));
    }

    @Test
    @DisplayName("Заявка на один день списывает один день")
    void submit_SameDayCountsAsOneDay() {
        // Given
        when(balanceLedger.debit("E1", LeaveType.ANNUAL, 1)).thenReturn(9L);
        when(leaveRequestRepository.insert(any(LeaveRequest.class))).thenAnswer(inv -> inv.getArgument(0));

        // When
        SubmissionResult result = leaveRequestService.submit(request("2024-06-10", "2024-06-10"));

        // Then
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getRequestedDays()).isEqualTo(1);
    }

    @Test
    @DisplayName("Подсчет дней включает обе даты и переход через месяц")
    void countDays_Inclusive() {
        assertThat(LeaveRequestService.countDays(LocalDate.parse("2024-06-01"), LocalDate.parse("2024-06-03")))
                .isEqualTo(3);
        assertThat(LeaveRequestService.countDays(LocalDate.parse("2024-02-28"), LocalDate.parse("2024-03-01")))
                .isEqualTo(3);
    }

    @Test
    @DisplayName("Дата окончания раньше даты начала - журнал не трогаем")
    void submit_InvalidDateRange() {
        // When
        SubmissionResult result = leaveRequestService.submit(request("2024-06-05", "2024-06-01"));

        // Then
        assertThat(result.getStatus()).isEqualTo(SubmissionResult.Status.INVALID_DATE_RANGE);
        assertThat(result.getRequestId()).isNull();
        assertThat(result.getRequestedDays()).isNull();
        verifyNoInteractions(balanceLedger, leaveRequestRepository);
    }

    @Test
    @DisplayName("Недостаточно дней - заявка не сохраняется")
    void submit_InsufficientBalance() {
        // Given
        when(balanceLedger.debit("E1", LeaveType.ANNUAL, 5))
                .thenThrow(new InsufficientBalanceException(new BalanceKey("E1", LeaveType.ANNUAL), 5, 2));

        // When
        SubmissionResult result = leaveRequestService.submit(request("2024-07-01", "2024-07-05"));

        // Then
        assertThat(result.getStatus()).isEqualTo(SubmissionResult.Status.INSUFFICIENT_BALANCE);
        assertThat(result.getRequestId()).isNull();
        assertThat(result.getRequestedDays()).isEqualTo(5);
        assertThat(result.getMessage()).contains("доступно 2");
        verifyNoInteractions(leaveRequestRepository);
    }

    @Test
    @DisplayName("Нет данных об остатке сотрудника")
    void submit_UnknownEmployee() {
        // Given
        when(balanceLedger.debit("E1", LeaveType.ANNUAL, 2))
                .thenThrow(new UnknownEmployeeException("E1", LeaveType.ANNUAL));

        // When
        SubmissionResult result = leaveRequestService.submit(request("2024-06-01", "2024-06-02"));

        // Then
        assertThat(result.getStatus()).isEqualTo(SubmissionResult.Status.UNKNOWN_EMPLOYEE);
        verifyNoInteractions(leaveRequestRepository);
    }

    @Test
    @DisplayName("Откат списания при ошибке хранилища")
    void submit_RollbackOnStorageFailure() {
        // Given
        when(balanceLedger.debit("E1", LeaveType.ANNUAL, 3)).thenReturn(7L);
        when(leaveRequestRepository.insert(any(LeaveRequest.class)))
                .thenThrow(new IllegalStateException("Хранилище недоступно"));

        // When / Then - ошибка хранилища пробрасывается без изменений
        assertThatThrownBy(() -> leaveRequestService.submit(request("2024-06-01", "2024-06-03")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("Хранилище недоступно");

        // Списанные дни возвращены
        verify(balanceLedger).credit("E1", LeaveType.ANNUAL, 3);
    }

    @Test
    @DisplayName("Ошибка возврата дней прикрепляется к ошибке хранилища")
    void submit_RollbackFailureIsSuppressed() {
        // Given - и сохранение, и возврат дней завершаются ошибкой
        IllegalStateException storageError = new IllegalStateException("Хранилище недоступно");
        IllegalStateException creditError = new IllegalStateException("Журнал недоступен");
        when(balanceLedger.debit("E1", LeaveType.ANNUAL, 3)).thenReturn(7L);
        when(leaveRequestRepository.insert(any(LeaveRequest.class))).thenThrow(storageError);
        when(balanceLedger.credit("E1", LeaveType.ANNUAL, 3)).thenThrow(creditError);

        // When / Then - наружу уходит исходная ошибка хранилища
        assertThatThrownBy(() -> leaveRequestService.submit(request("2024-06-01", "2024-06-03")))
                .isSameAs(storageError)
                .satisfies(e -> assertThat(e.getSuppressed()).containsExactly(creditError));
    }

    @Test
    @DisplayName("Успешная подача без отката")
    void submit_NoRollbackOnSuccess() {
        // Given
        when(balanceLedger.debit("E1", LeaveType.ANNUAL, 3)).thenReturn(7L);
        when(leaveRequestRepository.insert(any(LeaveRequest.class))).thenAnswer(inv -> inv.getArgument(0));

        // When
        leaveRequestService.submit(request("2024-06-01", "2024-06-03"));

        // Then
        verify(balanceLedger, never()).credit(anyString(), any(LeaveType.class), anyLong());
    }

    @Test
    @DisplayName("Поиск несуществующей заявки")
    void findRequest_NotFound() {
        when(leaveRequestRepository.findById("LR-MISSING")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> leaveRequestService.findRequest("LR-MISSING"))
                .isInstanceOf(LeaveRequestNotFoundException.class)
                .hasMessageContaining("LR-MISSING");
    }
}

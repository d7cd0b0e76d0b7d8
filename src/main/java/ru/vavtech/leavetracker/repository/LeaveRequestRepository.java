package ru.vavtech.leavetracker.repository;

import ru.vavtech.leavetracker.model.LeaveRequest;

import java.util.List;
import java.util.Optional;

/**
 * Хранилище принятых заявок на отпуск.
 * Заявки только добавляются: изменение и удаление не поддерживаются.
 */
public interface LeaveRequestRepository {

    /**
     * Сохранение новой заявки.
     *
     * @throws IllegalStateException если заявка с таким ID уже есть
     */
    LeaveRequest insert(LeaveRequest leaveRequest);

    Optional<LeaveRequest> findById(String requestId);

    /**
     * Заявки сотрудника, новые первыми
     */
    List<LeaveRequest> findByEmployeeId(String employeeId);
}

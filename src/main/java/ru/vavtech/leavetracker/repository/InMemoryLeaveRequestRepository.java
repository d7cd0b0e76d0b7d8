package ru.vavtech.leavetracker.repository;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;
import ru.vavtech.leavetracker.model.LeaveRequest;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Хранение заявок в памяти сервиса.
 * Ключ: ID заявки, значение: заявка.
 */
@Slf4j
@Repository
public class InMemoryLeaveRequestRepository implements LeaveRequestRepository {

    private final Map<String, LeaveRequest> requests = new ConcurrentHashMap<>();

    @Override
    public LeaveRequest insert(LeaveRequest leaveRequest) {
        LeaveRequest existing = requests.putIfAbsent(leaveRequest.getRequestId(), leaveRequest);
        if (existing != null) {
            throw new IllegalStateException("Заявка с ID " + leaveRequest.getRequestId() + " уже существует");
        }
        log.debug("Сохранена заявка {}", leaveRequest.getRequestId());
        return leaveRequest;
    }

    @Override
    public Optional<LeaveRequest> findById(String requestId) {
        return Optional.ofNullable(requests.get(requestId));
    }

    @Override
    public List<LeaveRequest> findByEmployeeId(String employeeId) {
        return requests.values().stream()
                .filter(request -> request.getEmployeeId().equals(employeeId))
                .sorted(Comparator.comparing(LeaveRequest::getCreatedAt).reversed())
                .toList();
    }
}

package ru.vavtech.leavetracker.model;

/**
 * Ключ остатка отпуска: сотрудник и вид отпуска.
 * По этому ключу сериализуются списания в {@link ru.vavtech.leavetracker.service.LeaveBalanceLedger}.
 */
public record BalanceKey(
        String employeeId,
        LeaveType leaveType
) {

    public BalanceKey {
        if (employeeId == null || employeeId.isBlank()) {
            throw new IllegalArgumentException("ID сотрудника не может быть пустым");
        }
        if (leaveType == null) {
            throw new IllegalArgumentException("Вид отпуска не может быть null");
        }
    }

    @Override
    public String toString() {
        return employeeId + "/" + leaveType;
    }
}

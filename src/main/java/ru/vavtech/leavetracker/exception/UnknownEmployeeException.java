package ru.vavtech.leavetracker.exception;

import lombok.Getter;
import ru.vavtech.leavetracker.model.LeaveType;

/**
 * Для сотрудника нет записи об остатке отпуска указанного вида.
 * Означает пробел в исходных данных, а не нулевой остаток.
 */
@Getter
public class UnknownEmployeeException extends RuntimeException {

    private final String employeeId;
    private final LeaveType leaveType;

    public UnknownEmployeeException(String employeeId, LeaveType leaveType) {
        super(leaveType == null
                ? "Нет данных об остатках отпуска сотрудника " + employeeId
                : "Нет данных об остатке отпуска вида " + leaveType + " для сотрудника " + employeeId);
        this.employeeId = employeeId;
        this.leaveType = leaveType;
    }

    public UnknownEmployeeException(String employeeId) {
        this(employeeId, null);
    }
}

package ru.vavtech.leavetracker.model;

/**
 * Виды отпусков, по которым ведется учет остатка дней.
 * Набор фиксирован для развертывания, новые виды добавляются в перечисление.
 */
public enum LeaveType {

    ANNUAL("Ежегодный оплачиваемый отпуск"),
    SICK("Больничный"),
    UNPAID("Отпуск без сохранения заработной платы");

    private final String displayName;

    LeaveType(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}

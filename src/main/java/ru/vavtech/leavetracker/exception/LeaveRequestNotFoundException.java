package ru.vavtech.leavetracker.exception;

public class LeaveRequestNotFoundException extends RuntimeException {

    public LeaveRequestNotFoundException(String requestId) {
        super("Заявка на отпуск не найдена: " + requestId);
    }
}

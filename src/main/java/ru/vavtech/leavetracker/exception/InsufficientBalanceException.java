package ru.vavtech.leavetracker.exception;

import lombok.Getter;
import ru.vavtech.leavetracker.model.BalanceKey;

/**
 * Запрошено больше дней, чем осталось. Остаток при этом не меняется.
 */
@Getter
public class InsufficientBalanceException extends RuntimeException {

    private final BalanceKey key;
    private final long requestedDays;
    private final long availableDays;

    public InsufficientBalanceException(BalanceKey key, long requestedDays, long availableDays) {
        super("Недостаточно дней отпуска " + key + ": запрошено " + requestedDays + ", доступно " + availableDays);
        this.key = key;
        this.requestedDays = requestedDays;
        this.availableDays = availableDays;
    }
}

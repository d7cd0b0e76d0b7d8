package ru.vavtech.leavetracker.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import ru.vavtech.leavetracker.config.LeaveProperties;
import ru.vavtech.leavetracker.exception.InsufficientBalanceException;
import ru.vavtech.leavetracker.exception.UnknownEmployeeException;
import ru.vavtech.leavetracker.model.BalanceKey;
import ru.vavtech.leavetracker.model.LeaveType;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Журнал остатков отпуска по сотрудникам и видам отпуска.
 * <p>
 * Единственный владелец остатков: изменить их можно только через этот сервис.
 * Списания по одному ключу (сотрудник + вид отпуска) выполняются строго по очереди
 * под блокировкой этого ключа, списания по разным ключам друг друга не ждут.
 * Общая блокировка на запись берется только при полной переинициализации журнала.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LeaveBalanceLedger {

    private final LeaveProperties leaveProperties;

    private final Map<BalanceKey, Long> balances = new ConcurrentHashMap<>();

    /**
     * Блокировки по ключам. Создаются при первом обращении и не удаляются.
     */
    private final Map<BalanceKey, ReentrantLock> keyLocks = new ConcurrentHashMap<>();

    private final ReentrantReadWriteLock ledgerLock = new ReentrantReadWriteLock();

    /**
     * Заполнение журнала начальными остатками из конфигурации.
     * Все ранее накопленные остатки сбрасываются.
     */
    public void initializeBalances() {
        ledgerLock.writeLock().lock();
        try {
            balances.clear();
            keyLocks.clear();
            leaveProperties.getInitialBalances().forEach((employeeId, byType) ->
                    byType.forEach((leaveType, days) -> {
                        requireNonNegative(days);
                        balances.put(new BalanceKey(employeeId, leaveType), days);
                    }));
            log.info("Журнал остатков отпусков инициализирован: {} записей", balances.size());
        } finally {
            ledgerLock.writeLock().unlock();
        }
    }

    /**
     * Текущий остаток дней
     *
     * @throws UnknownEmployeeException если для пары сотрудник/вид отпуска нет записи
     */
    public long getBalance(String employeeId, LeaveType leaveType) {
        BalanceKey key = new BalanceKey(employeeId, leaveType);
        ledgerLock.readLock().lock();
        try {
            Long days = balances.get(key);
            if (days == null) {
                throw new UnknownEmployeeException(employeeId, leaveType);
            }
            return days;
        } finally {
            ledgerLock.readLock().unlock();
        }
    }

    /**
     * Все известные остатки сотрудника
     */
    public Map<LeaveType, Long> getBalances(String employeeId) {
        Map<LeaveType, Long> result = new EnumMap<>(LeaveType.class);
        ledgerLock.readLock().lock();
        try {
            balances.forEach((key, days) -> {
                if (key.employeeId().equals(employeeId)) {
                    result.put(key.leaveType(), days);
                }
            });
        } finally {
            ledgerLock.readLock().unlock();
        }
        if (result.isEmpty()) {
            throw new UnknownEmployeeException(employeeId);
        }
        return result;
    }

    /**
     * Списание дней отпуска.
     * Проверка остатка и списание выполняются атомарно под блокировкой ключа:
     * два параллельных списания не могут вместе увести остаток в минус.
     *
     * @param days количество дней, должно быть положительным
     * @return остаток после списания
     * @throws UnknownEmployeeException если для пары нет записи
     * @throws InsufficientBalanceException если дней не хватает, остаток при этом не меняется
     */
    public long debit(String employeeId, LeaveType leaveType, long days) {
        if (days <= 0) {
            throw new IllegalArgumentException("Количество дней для списания должно быть положительным");
        }
        BalanceKey key = new BalanceKey(employeeId, leaveType);
        return withExistingKeyLock(key, () -> {
            long current = balances.get(key);
            if (days > current) {
                throw new InsufficientBalanceException(key, days, current);
            }
            long remaining = current - days;
            balances.put(key, remaining);
            log.debug("Списано {} дн. по {}, остаток {}", days, key, remaining);
            return remaining;
        });
    }

    /**
     * Возврат ранее списанных дней (компенсация неудачной операции)
     *
     * @return остаток после возврата
     */
    public long credit(String employeeId, LeaveType leaveType, long days) {
        if (days <= 0) {
            throw new IllegalArgumentException("Количество дней для возврата должно быть положительным");
        }
        BalanceKey key = new BalanceKey(employeeId, leaveType);
        return withExistingKeyLock(key, () -> {
            long current = balances.get(key);
            long restored = Math.addExact(current, days);
            balances.put(key, restored);
            log.debug("Возвращено {} дн. по {}, остаток {}", days, key, restored);
            return restored;
        });
    }

    /**
     * Установка остатка напрямую (заведение нового сотрудника, загрузка данных)
     */
    public void setBalance(String employeeId, LeaveType leaveType, long days) {
        requireNonNegative(days);
        BalanceKey key = new BalanceKey(employeeId, leaveType);
        withKeyLock(key, () -> balances.put(key, days));
        log.info("Установлен остаток {} дн. по {}", days, key);
    }

    /**
     * Операция над уже существующим остатком. Для неизвестного ключа блокировка не создается.
     * Ключи удаляются только под блокировкой на запись, поэтому проверка под блокировкой
     * на чтение остается верной до конца операции.
     */
    private <T> T withExistingKeyLock(BalanceKey key, LockedOperation<T> operation) {
        ledgerLock.readLock().lock();
        try {
            if (!balances.containsKey(key)) {
                throw new UnknownEmployeeException(key.employeeId(), key.leaveType());
            }
            return runUnderKeyLock(key, operation);
        } finally {
            ledgerLock.readLock().unlock();
        }
    }

    private <T> T withKeyLock(BalanceKey key, LockedOperation<T> operation) {
        ledgerLock.readLock().lock();
        try {
            return runUnderKeyLock(key, operation);
        } finally {
            ledgerLock.readLock().unlock();
        }
    }

    private <T> T runUnderKeyLock(BalanceKey key, LockedOperation<T> operation) {
        ReentrantLock keyLock = keyLocks.computeIfAbsent(key, k -> new ReentrantLock());
        keyLock.lock();
        try {
            return operation.run();
        } finally {
            keyLock.unlock();
        }
    }

    /**
     * Количество ключей, для которых созданы блокировки
     */
    int lockedKeyCount() {
        return keyLocks.size();
    }

    private static void requireNonNegative(Long days) {
        if (days == null || days < 0) {
            throw new IllegalArgumentException("Остаток отпуска не может быть отрицательным");
        }
    }

    @FunctionalInterface
    private interface LockedOperation<T> {
        T run();
    }
}

package ru.aritmos.intakequeue;

import io.micronaut.runtime.Micronaut;

/**
 * Точка входа сервиса очереди пациентов.
 * <p>
 * Сервис классифицирует симптомы (внешний классификатор с локальным резервом), ставит пациента в очередь
 * услуги по приоритету и отслеживает позицию и оценку ожидания до завершения обслуживания.
 * <p>
 * Система учёта (услуги, пациенты, записи) — внешняя граница; по умолчанию используется in-memory реализация.
 */
public final class Application {

    private Application() {
        // утилитарный класс
    }

    public static void main(String[] args) {
        Micronaut.run(Application.class, args);
    }
}

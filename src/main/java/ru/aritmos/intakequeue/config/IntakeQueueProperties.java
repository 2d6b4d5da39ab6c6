package ru.aritmos.intakequeue.config;

import io.micronaut.context.annotation.ConfigurationProperties;

import java.time.Duration;

/**
 * Typed-конфигурация Intake Queue.
 * <p>
 * Единая точка чтения настроек из application.yml/ENV. Некорректные значения (ноль, отрицательные
 * числа, null) не ломают сервис: сеттеры возвращают значение по умолчанию.
 */
@ConfigurationProperties("intakequeue")
public class IntakeQueueProperties {

    private Queue queue = new Queue();
    private Catalog catalog = new Catalog();
    private Triage triage = new Triage();
    private Session session = new Session();

    public Queue getQueue() {
        return queue;
    }

    public void setQueue(Queue queue) {
        this.queue = queue == null ? new Queue() : queue;
    }

    public Catalog getCatalog() {
        return catalog;
    }

    public void setCatalog(Catalog catalog) {
        this.catalog = catalog == null ? new Catalog() : catalog;
    }

    public Triage getTriage() {
        return triage;
    }

    public void setTriage(Triage triage) {
        this.triage = triage == null ? new Triage() : triage;
    }

    public Session getSession() {
        return session;
    }

    public void setSession(Session session) {
        this.session = session == null ? new Session() : session;
    }

    /**
     * Настройки очереди: интервал опроса статуса, среднее время обслуживания, идемпотентность.
     */
    @ConfigurationProperties("queue")
    public static class Queue {
        private int refreshIntervalSeconds = 30;
        private int defaultAverageServiceMinutes = 15;
        private int idempotencyTtlSeconds = 600;

        public int getRefreshIntervalSeconds() {
            return refreshIntervalSeconds;
        }

        public void setRefreshIntervalSeconds(int refreshIntervalSeconds) {
            this.refreshIntervalSeconds = refreshIntervalSeconds > 0 ? refreshIntervalSeconds : 30;
        }

        public int getDefaultAverageServiceMinutes() {
            return defaultAverageServiceMinutes;
        }

        public void setDefaultAverageServiceMinutes(int defaultAverageServiceMinutes) {
            this.defaultAverageServiceMinutes = defaultAverageServiceMinutes > 0 ? defaultAverageServiceMinutes : 15;
        }

        public int getIdempotencyTtlSeconds() {
            return idempotencyTtlSeconds;
        }

        public void setIdempotencyTtlSeconds(int idempotencyTtlSeconds) {
            this.idempotencyTtlSeconds = idempotencyTtlSeconds > 0 ? idempotencyTtlSeconds : 600;
        }

        public Duration refreshInterval() {
            return Duration.ofSeconds(refreshIntervalSeconds);
        }
    }

    /**
     * Настройки каталога услуг.
     */
    @ConfigurationProperties("catalog")
    public static class Catalog {
        private int refreshIntervalSeconds = 300;
        private String path = "classpath:catalog/services.json";

        public int getRefreshIntervalSeconds() {
            return refreshIntervalSeconds;
        }

        public void setRefreshIntervalSeconds(int refreshIntervalSeconds) {
            this.refreshIntervalSeconds = refreshIntervalSeconds > 0 ? refreshIntervalSeconds : 300;
        }

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = (path == null || path.isBlank()) ? "classpath:catalog/services.json" : path.trim();
        }

        public Duration refreshInterval() {
            return Duration.ofSeconds(refreshIntervalSeconds);
        }
    }

    @ConfigurationProperties("triage")
    public static class Triage {
        private External external = new External();

        public External getExternal() {
            return external;
        }

        public void setExternal(External external) {
            this.external = external == null ? new External() : external;
        }

        /**
         * Внешний (ИИ) классификатор симптомов. По умолчанию выключен: работает локальный классификатор.
         */
        @ConfigurationProperties("external")
        public static class External {
            private boolean enabled = false;
            private String url;
            private long timeoutMs = 5000;

            public boolean isEnabled() {
                return enabled;
            }

            public void setEnabled(boolean enabled) {
                this.enabled = enabled;
            }

            public String getUrl() {
                return url;
            }

            public void setUrl(String url) {
                this.url = (url == null || url.isBlank()) ? null : url.trim();
            }

            public long getTimeoutMs() {
                return timeoutMs;
            }

            public void setTimeoutMs(long timeoutMs) {
                this.timeoutMs = timeoutMs > 0 ? timeoutMs : 5000;
            }
        }
    }

    @ConfigurationProperties("session")
    public static class Session {
        private int maxNotifications = 50;

        public int getMaxNotifications() {
            return maxNotifications;
        }

        public void setMaxNotifications(int maxNotifications) {
            this.maxNotifications = maxNotifications > 0 ? maxNotifications : 50;
        }
    }
}

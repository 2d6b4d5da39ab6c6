package ru.aritmos.intakequeue.core;

import java.util.regex.Pattern;

/**
 * Санитайзер персональных данных пациента для логов и сообщений об ошибках.
 * <p>
 * Назначение:
 * <ul>
 *   <li>не допустить попадания e-mail, телефонов и токенов в логи;</li>
 *   <li>обеспечить единообразную политику маскирования для всех слоёв (триаж, очередь, сессии).</li>
 * </ul>
 * <p>
 * Важно: санитайзер работает эвристически и не является DLP-системой. Поэтому сами карточки
 * пациента ({@code PatientDetails}) в логи не передаются вообще, а через санитайзер проходят только
 * тексты ошибок внешних систем.
 */
public final class SensitiveDataSanitizer {

    private SensitiveDataSanitizer() {
    }

    private static final String MASK = "***";

    private static final Pattern BEARER = Pattern.compile("(?i)bearer\\s+\\S+");
    private static final Pattern SECRET_PARAM = Pattern.compile("(?i)(api_key|apikey|access_token|token)\\s*=\\s*[^\\s&]+");
    private static final Pattern EMAIL = Pattern.compile("[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}");
    // Телефон: 7+ цифр подряд с допустимыми разделителями.
    private static final Pattern PHONE = Pattern.compile("\\+?\\d[\\d\\s()-]{5,}\\d");

    /**
     * Санитизировать текст (сообщения об ошибках, диагностические строки).
     *
     * @param text исходный текст
     * @return санитизированный текст или исходное значение, если оно пустое
     */
    public static String sanitizeText(String text) {
        if (text == null || text.isBlank()) {
            return text;
        }

        String t = BEARER.matcher(text).replaceAll("Bearer " + MASK);
        t = SECRET_PARAM.matcher(t).replaceAll("$1=" + MASK);
        t = EMAIL.matcher(t).replaceAll(MASK + "@" + MASK);
        t = PHONE.matcher(t).replaceAll(MASK);

        // Избегаем многострочности в сообщениях.
        t = t.replaceAll("[\\r\\n\\t]", " ").trim();
        return t;
    }

    /**
     * Сообщение для пользователя: конкретное сообщение внешней системы, если оно есть,
     * иначе общий текст о сетевой ошибке.
     *
     * @param specific сообщение из ответа внешней системы (может быть null)
     * @return безопасное сообщение
     */
    public static String userMessage(String specific) {
        String s = sanitizeText(specific);
        if (s == null || s.isBlank()) {
            return "Ошибка сети. Проверьте соединение и повторите попытку.";
        }
        return s;
    }
}

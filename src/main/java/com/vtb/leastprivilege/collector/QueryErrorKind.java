package com.vtb.leastprivilege.collector;

/**
 * Вид ошибки запроса к хранилищу логов
 */
public enum QueryErrorKind {
    NONE,
    // Ответ превысил лимит размера хранилища - лечится делением окна
    SIZE_EXCEEDED,
    OTHER
}

package com.vtb.leastprivilege.collector;

import com.vtb.leastprivilege.models.ActivityWindow;

/**
 * Клиент хранилища журнала активности Microsoft Graph
 */
public interface ActivityLogClient {

    /**
     * Получить уникальные пары (метод, URI) успешных вызовов приложения за окно
     *
     * @param principalId идентификатор service principal
     * @param window окно [start, end) и лимит строк
     * @return результат запроса; ошибки передаются через {@link QueryErrorKind}, а не исключениями
     */
    ActivityQueryResult query(String principalId, ActivityWindow window);
}

package com.vtb.leastprivilege.models;

import lombok.Value;

/**
 * Единица покрытия: метод + версия + путь.
 * Разные URI с одинаковой канонической формой сворачиваются в один ключ.
 */
@Value
public class ActivityKey {
    String method;
    String version;
    String path;
}

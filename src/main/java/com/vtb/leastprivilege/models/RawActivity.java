package com.vtb.leastprivilege.models;

import lombok.Builder;
import lombok.Value;

/**
 * Успешный вызов API в том виде, в котором его вернуло хранилище логов
 */
@Value
@Builder
public class RawActivity {
    String method;
    String uri;
}

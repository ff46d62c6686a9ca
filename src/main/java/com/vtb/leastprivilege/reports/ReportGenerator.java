package com.vtb.leastprivilege.reports;

import com.vtb.leastprivilege.models.AnalysisReport;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Интерфейс для генераторов отчетов
 */
public interface ReportGenerator {

    /**
     * Сгенерировать отчет
     *
     * @param report результат анализа
     * @param outputPath путь для сохранения отчета
     * @throws IOException если произошла ошибка записи
     */
    void generate(AnalysisReport report, Path outputPath) throws IOException;

    /**
     * Получить расширение файла отчета
     */
    String getFileExtension();
}

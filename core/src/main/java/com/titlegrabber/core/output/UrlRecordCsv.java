package com.titlegrabber.core.output;

import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;

/** 출력/캐시 파일 공용 CSV 매퍼 설정 */
public final class UrlRecordCsv {
    private UrlRecordCsv() {}

    public static final String HEADER = "url,end_url,page_title,article_title";

    private static final CsvMapper MAPPER = CsvMapper.builder()
            .enable(CsvParser.Feature.IGNORE_TRAILING_UNMAPPABLE)
            .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
            .build();

    /** 헤더는 직접 기록하므로 스키마는 헤더 없음 */
    public static ObjectWriter writer() {
        CsvSchema schema = MAPPER.schemaFor(CsvRow.class).withoutHeader();
        return MAPPER.writerFor(CsvRow.class).with(schema);
    }

    /** 파일 자신의 헤더로 컬럼 매핑 */
    public static ObjectReader reader() {
        return MAPPER.readerFor(CsvRow.class).with(CsvSchema.emptySchema().withHeader());
    }
}

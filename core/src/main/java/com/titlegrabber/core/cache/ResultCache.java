package com.titlegrabber.core.cache;

import com.fasterxml.jackson.databind.MappingIterator;
import com.titlegrabber.core.model.UrlRecord;
import com.titlegrabber.core.output.CsvRow;
import com.titlegrabber.core.output.UrlRecordCsv;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 이전 출력 파일을 재개용 캐시로 읽는다(url → 레코드).
 * - 실행 시작 전 한 번 만들고 이후 읽기 전용 → 워커 간 동기화 불필요
 * - 제목이 하나라도 있는 행만 보관(실패 행은 다음 실행에서 재시도)
 * - 파일 없음/읽기 불가 → 빈 캐시. 깨진 행은 건너뜀
 */
public final class ResultCache {

    private static final Logger LOG = LoggerFactory.getLogger(ResultCache.class);

    private static final ResultCache EMPTY = new ResultCache(Map.of());

    private final Map<String, UrlRecord> byUrl;

    private ResultCache(Map<String, UrlRecord> byUrl) {
        this.byUrl = byUrl;
    }

    public static ResultCache empty() { return EMPTY; }

    /** 테스트/조립용 */
    public static ResultCache of(Map<String, UrlRecord> entries) {
        Map<String, UrlRecord> m = new LinkedHashMap<>();
        entries.forEach((k, v) -> { if (v != null && v.hasAnyTitle()) m.put(k, v); });
        return new ResultCache(Collections.unmodifiableMap(m));
    }

    public static ResultCache load(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            LOG.debug("No previous output at {}", path);
            return EMPTY;
        }

        Map<String, UrlRecord> m = new LinkedHashMap<>();
        int skipped = 0;
        try (Reader in = Files.newBufferedReader(path, StandardCharsets.UTF_8);
             MappingIterator<CsvRow> it = UrlRecordCsv.reader().readValues(in)) {
            while (true) {
                try {
                    if (!it.hasNextValue()) break;
                } catch (IOException e) {
                    // 구조가 깨진 지점 이후는 신뢰 불가 → 여기까지 읽은 것만 사용
                    LOG.warn("Cache read stopped at {}: {}", path, e.getMessage());
                    break;
                }
                try {
                    UrlRecord r = it.nextValue().toRecord();
                    if (r == null || !r.hasAnyTitle()) {
                        skipped++;
                        continue;
                    }
                    m.putIfAbsent(r.getUrl(), r);
                } catch (IOException | RuntimeException e) {
                    skipped++;
                    LOG.debug("Skipping malformed cache row in {}: {}", path, e.getMessage());
                }
            }
        } catch (IOException | RuntimeException e) {
            LOG.warn("Unable to read previous output {}: {}", path, e.toString());
        }

        LOG.info("Loaded {} cached rows from {} (skipped {})", m.size(), path, skipped);
        return new ResultCache(Collections.unmodifiableMap(m));
    }

    public Optional<UrlRecord> get(String url) {
        return Optional.ofNullable(byUrl.get(url));
    }

    public int size() { return byUrl.size(); }

}

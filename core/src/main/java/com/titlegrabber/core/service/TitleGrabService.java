package com.titlegrabber.core.service;

import com.titlegrabber.core.api.GrabObserver;
import com.titlegrabber.core.api.IPageFetcher;
import com.titlegrabber.core.api.ITitleExtractor;
import com.titlegrabber.core.api.RecordSink;
import com.titlegrabber.core.cache.ResultCache;
import com.titlegrabber.core.extract.HtmlDocuments;
import com.titlegrabber.core.extract.JsoupTitleExtractor;
import com.titlegrabber.core.http.PageFetcher;
import com.titlegrabber.core.input.UrlScanner;
import com.titlegrabber.core.model.FetchedPage;
import com.titlegrabber.core.model.GrabConfig;
import com.titlegrabber.core.model.GrabStats;
import com.titlegrabber.core.model.PageTitles;
import com.titlegrabber.core.model.UrlRecord;
import com.titlegrabber.core.output.CsvRecordWriter;
import com.titlegrabber.core.permalink.PermalinkResolver;
import com.titlegrabber.core.util.UrlUtils;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 오케스트레이터: scan → (cache | fetch → extract → permalink) → write
 *  - 캐시 적중은 디스패처 스레드에서 즉시 기록(입력 순서 유지)
 *  - 나머지는 워커 풀로 제출, 결과 채널(MPSC 큐)에 Optional로 1건씩 적재
 *  - 입력 소진 후 전체 join, 제출 수만큼 정확히 드레인
 *  - URL 단위 실패는 워커 안에서 흡수(행 없음), 파일 시스템 실패만 IOException으로 전파
 */
public final class TitleGrabService {

    private static final Logger LOG = LoggerFactory.getLogger(TitleGrabService.class);

    private final GrabStats stats = new GrabStats();
    private final List<Path> inputPaths;
    private final Path outputPath;
    private final int maxThreads;
    private final IPageFetcher fetcher;
    private final ITitleExtractor extractor;
    private final PermalinkResolver permalinks;
    private final GrabObserver observer;

    /** 기본 구현 */
    public TitleGrabService(GrabConfig config) {
        this(config, new LoggingGrabObserver());
    }

    public TitleGrabService(GrabConfig config, GrabObserver observer) {
        this(config, new PageFetcher(config, observer), new JsoupTitleExtractor(), observer);
    }

    /** DI/테스트용 */
    public TitleGrabService(GrabConfig config, IPageFetcher fetcher, ITitleExtractor extractor, GrabObserver observer) {
        Objects.requireNonNull(config, "config");
        config.validate();
        this.inputPaths = List.copyOf(config.getInputPaths());
        this.outputPath = config.getOutputPath();
        this.maxThreads = config.getMaxThreads();
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.observer = (observer != null) ? observer : GrabObserver.NONE;

        IPageFetcher raw = Objects.requireNonNull(fetcher, "fetcher");
        this.fetcher = url -> {
            FetchedPage p = raw.fetch(url);
            stats.addAttempts(p.getAttempts());
            return p;
        };
        this.permalinks = new PermalinkResolver(config.getPermalink(), this.fetcher);
    }

    /**
     * 이전 출력을 캐시로 읽은 뒤 같은 경로에 새로 기록.
     * 옆의 임시 파일(.part)에 쓰고 실행이 끝까지 성공했을 때만 교체한다.
     * 실패하면 이전 출력(= 다음 실행의 캐시)은 그대로 남는다.
     */
    public GrabStats.Snapshot run() throws IOException {
        ResultCache cache = ResultCache.load(outputPath);
        Path staging = stagingPathFor(outputPath);
        boolean published = false;
        try {
            Path written;
            int rows;
            try (CsvRecordWriter sink = CsvRecordWriter.open(staging)) {
                run(cache, sink);
                written = sink.getPath();
                rows = sink.getRowCount();
            }
            publish(written, outputPath);
            published = true;
            LOG.info("Wrote {} rows to {}", rows, outputPath);
        } finally {
            if (!published) discard(staging);
        }
        return stats.snapshot();
    }

    static Path stagingPathFor(Path output) {
        Path abs = output.toAbsolutePath();
        return abs.resolveSibling(abs.getFileName() + ".part");
    }

    private static void publish(Path from, Path to) throws IOException {
        try {
            Files.move(from, to, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(from, to, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void discard(Path staging) {
        try {
            Files.deleteIfExists(staging);
        } catch (IOException e) {
            LOG.warn("Unable to remove partial output {}: {}", staging, e.toString());
        }
    }

    public GrabStats.Snapshot run(ResultCache cache, RecordSink sink) throws IOException {
        Objects.requireNonNull(cache, "cache");
        Objects.requireNonNull(sink, "sink");

        LOG.info("Grab start: files={}, output={}, cached={}, threads={}",
                inputPaths.size(), outputPath, cache.size(), maxThreads);

        final BlockingQueue<Optional<UrlRecord>> results = new LinkedBlockingQueue<>();
        final Set<String> seen = new HashSet<>();
        final AtomicInteger inFlight = new AtomicInteger(0);

        try (WorkerPool pool = new WorkerPool(maxThreads, "grab-worker")) {
            // ---- 1) 스캔 + 디스패치 ----
            for (Path file : inputPaths) {
                observer.onFileStart(file);
                UrlScanner.scan(file, url -> {
                    if (!seen.add(url)) {
                        stats.duplicate();
                        return;
                    }
                    Optional<UrlRecord> cached = cache.get(url);
                    if (cached.isPresent()) {
                        stats.cacheHit();
                        observer.onCacheHit(url);
                        sink.write(cached.get());
                        return;
                    }
                    pool.submit(() -> {
                        stats.observeConcurrency(inFlight.incrementAndGet());
                        Optional<UrlRecord> r = Optional.empty();
                        try {
                            r = process(url);
                        } finally {
                            // 작업 1건 = 결과 1건 (드레인 횟수와 일치해야 함)
                            results.add(r);
                            inFlight.decrementAndGet();
                        }
                    });
                });
            }

            // ---- 2) 전체 join ----
            pool.join();

            // ---- 3) 제출 수만큼 정확히 드레인 ----
            int n = pool.submittedCount();
            for (int i = 0; i < n; i++) {
                Optional<UrlRecord> r;
                try {
                    r = results.take();
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new CancellationException("Interrupted while draining results");
                }
                if (r.isPresent()) sink.write(r.get());
            }
        }

        GrabStats.Snapshot snap = stats.snapshot();
        observer.onFinished(snap);
        return snap;
    }

    /** URL 1건 처리. 예외를 던지지 않으며 실패 시 empty("레코드 없음") */
    Optional<UrlRecord> process(String url) {
        try {
            Optional<URI> uri = UrlUtils.parseHttp(url);
            if (uri.isEmpty()) return giveUp(url, "unparsable url");

            FetchedPage page = fetcher.fetch(uri.get());
            if (!page.isSuccess()) {
                return giveUp(url, page.hasResponse()
                        ? String.valueOf(page.getStatusCode())
                        : String.valueOf(page.getError()));
            }
            LOG.info("GET {} - [{}]", url, page.getStatusCode());

            Document doc;
            try {
                doc = HtmlDocuments.parse(page);
            } catch (IOException e) {
                return giveUp(url, "unparsable html: " + e.getMessage());
            }

            PageTitles titles = extractor.extract(doc);
            String endUrl = permalinks.resolveEndUrl(doc, page.getFinalUrl());

            UrlRecord record = new UrlRecord(url, endUrl, titles.pageTitle(), titles.articleTitle());
            stats.fetched();
            observer.onRecord(record);
            return Optional.of(record);
        } catch (RuntimeException e) {
            LOG.warn("Processing failed for {}", url, e);
            return giveUp(url, e.toString());
        }
    }

    private Optional<UrlRecord> giveUp(String url, String reason) {
        stats.failed();
        observer.onGiveUp(url, reason);
        return Optional.empty();
    }
}

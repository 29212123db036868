package com.titlegrabber.core.service;

import com.fasterxml.jackson.databind.MappingIterator;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import com.titlegrabber.core.api.GrabObserver;
import com.titlegrabber.core.model.GrabConfig;
import com.titlegrabber.core.model.GrabStats;
import com.titlegrabber.core.model.UrlRecord;
import com.titlegrabber.core.output.CsvRow;
import com.titlegrabber.core.output.UrlRecordCsv;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.OutputStream;
import java.io.Reader;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/** 로컬 HttpServer + 실제 HttpClient로 전체 파이프라인 확인 */
class TitleGrabEndToEndTest {

    @TempDir Path tmp;

    private HttpServer server;
    private String base;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/page1", ex -> html(ex, 200, "<html><head><title> Foo  Bar </title></head><body></body></html>"));
        server.createContext("/article", ex -> html(ex, 200,
                "<title>News</title><h1>Menu</h1><article><h1>  Big\n  Story </h1></article>"));
        server.createContext("/moved", ex -> {
            ex.getResponseHeaders().add("Location", "/page1");
            ex.sendResponseHeaders(302, -1);
            ex.close();
        });
        server.createContext("/missing", ex -> html(ex, 404, "<title>Not Found</title>"));
        server.start();
        base = "http://127.0.0.1:" + server.getAddress().getPort();
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    private static void html(HttpExchange ex, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        ex.getResponseHeaders().add("Content-Type", "text/html; charset=UTF-8");
        ex.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = ex.getResponseBody()) {
            os.write(bytes);
        }
    }

    private static List<UrlRecord> readRows(Path csv) throws IOException {
        List<UrlRecord> out = new ArrayList<>();
        try (Reader in = Files.newBufferedReader(csv, StandardCharsets.UTF_8);
             MappingIterator<CsvRow> it = UrlRecordCsv.reader().readValues(in)) {
            while (it.hasNextValue()) out.add(it.nextValue().toRecord());
        }
        return out;
    }

    @Test
    void grabs_titles_follows_redirects_and_skips_failures() throws Exception {
        Path in = tmp.resolve("urls.txt");
        Files.write(in, List.of(
                "see " + base + "/page1 thanks",
                base + "/moved",
                base + "/article",
                base + "/missing",
                "no url on this line"), StandardCharsets.UTF_8);
        Path out = tmp.resolve("out/result.csv");

        GrabConfig cfg = GrabConfig.defaults()
                .setInputPaths(List.of(in))
                .setOutputPath(out)
                .setMaxRetries(0)
                .setMaxThreads(2);

        GrabStats.Snapshot s = new TitleGrabService(cfg, GrabObserver.NONE).run();

        assertThat(Files.readAllLines(out, StandardCharsets.UTF_8).get(0)).isEqualTo(UrlRecordCsv.HEADER);
        assertThat(readRows(out)).containsExactlyInAnyOrder(
                new UrlRecord(base + "/page1", base + "/page1", "Foo Bar", ""),
                new UrlRecord(base + "/moved", base + "/page1", "Foo Bar", ""),
                new UrlRecord(base + "/article", base + "/article", "News", "Big Story"));
        assertThat(s.fetched).isEqualTo(3);
        assertThat(s.failed).isEqualTo(1);
    }
}

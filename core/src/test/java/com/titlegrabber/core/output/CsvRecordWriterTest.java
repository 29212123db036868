package com.titlegrabber.core.output;

import com.fasterxml.jackson.databind.MappingIterator;
import com.titlegrabber.core.cache.ResultCache;
import com.titlegrabber.core.model.UrlRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CsvRecordWriterTest {

    @TempDir Path tmp;

    private static List<UrlRecord> readAll(Path p) throws IOException {
        List<UrlRecord> out = new ArrayList<>();
        try (Reader in = Files.newBufferedReader(p, StandardCharsets.UTF_8);
             MappingIterator<CsvRow> it = UrlRecordCsv.reader().readValues(in)) {
            while (it.hasNextValue()) out.add(it.nextValue().toRecord());
        }
        return out;
    }

    @Test
    void writes_header_then_rows_in_write_order() throws Exception {
        Path p = tmp.resolve("nested/dir/out.csv");
        UrlRecord a = new UrlRecord("https://a.com", "https://a.com/", "Foo Bar", "");
        UrlRecord b = new UrlRecord("https://t.co/x",
                "https://twitter.com/a/status/1,https://twitter.com/b/status/2", "Say \"hi\", all", "Heading");
        UrlRecord c = new UrlRecord("https://c.com", "https://c.com/", "", "");

        try (CsvRecordWriter w = CsvRecordWriter.open(p)) {
            w.write(a);
            w.write(b);
            w.write(c);
            assertThat(w.getRowCount()).isEqualTo(3);
        }

        assertThat(Files.readAllLines(p, StandardCharsets.UTF_8).get(0)).isEqualTo(UrlRecordCsv.HEADER);
        assertThat(readAll(p)).containsExactly(a, b, c);
    }

    @Test
    void output_reloads_as_cache() throws Exception {
        Path p = tmp.resolve("out.csv");
        UrlRecord titled = new UrlRecord("https://a.com", "https://a.com/", "Título ñ", "");
        UrlRecord untitled = new UrlRecord("https://b.com", "https://b.com/", "", "");
        try (CsvRecordWriter w = CsvRecordWriter.open(p)) {
            w.write(titled);
            w.write(untitled);
        }

        ResultCache cache = ResultCache.load(p);

        assertThat(cache.get("https://a.com")).contains(titled);
        assertThat(cache.get("https://b.com")).isEmpty();
    }

    @Test
    void opening_truncates_previous_content() throws Exception {
        Path p = tmp.resolve("out.csv");
        Files.writeString(p, "garbage\nmore garbage\nand more\n");

        try (CsvRecordWriter w = CsvRecordWriter.open(p)) {
            w.write(new UrlRecord("https://a.com", "https://a.com/", "A", ""));
        }

        assertThat(Files.readAllLines(p)).hasSize(2);
    }

    @Test
    void unwritable_destination_fails_with_io_exception() throws Exception {
        Path dir = Files.createDirectory(tmp.resolve("taken"));
        assertThatThrownBy(() -> CsvRecordWriter.open(dir)).isInstanceOf(IOException.class);
    }
}

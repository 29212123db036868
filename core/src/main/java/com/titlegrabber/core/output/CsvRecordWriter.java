package com.titlegrabber.core.output;

import com.fasterxml.jackson.databind.SequenceWriter;
import com.titlegrabber.core.api.RecordSink;
import com.titlegrabber.core.model.UrlRecord;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * 결과 CSV 작성기. 열 때 헤더를 쓰고, 이후 write 순서 그대로 기록한다.
 * 열기 실패는 IOException으로 전파(실행 전체 중단).
 */
public final class CsvRecordWriter implements RecordSink {

    private final Path path;
    private final SequenceWriter seq;
    private int rows = 0;

    private CsvRecordWriter(Path path, SequenceWriter seq) {
        this.path = path;
        this.seq = seq;
    }

    public static CsvRecordWriter open(Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);

        BufferedWriter out = Files.newBufferedWriter(path, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
        try {
            out.write(UrlRecordCsv.HEADER);
            out.write('\n');
            return new CsvRecordWriter(path, UrlRecordCsv.writer().writeValues(out));
        } catch (IOException e) {
            try { out.close(); } catch (IOException suppressed) { e.addSuppressed(suppressed); }
            throw e;
        }
    }

    @Override
    public void write(UrlRecord record) throws IOException {
        seq.write(CsvRow.of(record));
        rows++;
    }

    public int getRowCount() { return rows; }
    public Path getPath() { return path; }

    @Override
    public void close() throws IOException {
        seq.close();
    }
}

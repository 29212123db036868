package com.titlegrabber.core.api;

import com.titlegrabber.core.model.UrlRecord;

import java.io.IOException;

/** 결과 행 싱크. 디스패처 스레드에서만 호출된다. */
public interface RecordSink extends AutoCloseable {
    void write(UrlRecord record) throws IOException;
    @Override void close() throws IOException;
}

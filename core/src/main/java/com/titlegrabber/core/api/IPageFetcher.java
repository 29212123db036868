package com.titlegrabber.core.api;

import com.titlegrabber.core.model.FetchedPage;

import java.net.URI;

/** 페치 최소 계약: 재시도/리다이렉트 처리 후 결과를 돌려준다. 예외 대신 status -1. */
@FunctionalInterface
public interface IPageFetcher {
    FetchedPage fetch(URI url);
}

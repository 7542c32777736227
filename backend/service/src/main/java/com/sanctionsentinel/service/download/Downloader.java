package com.sanctionsentinel.service.download;

import com.sanctionsentinel.sources.api.SourceFetchConfig;

@FunctionalInterface
public interface Downloader {
    DownloadResult fetch(SourceFetchConfig config);
}

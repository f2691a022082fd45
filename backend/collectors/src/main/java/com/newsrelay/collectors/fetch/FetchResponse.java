package com.newsrelay.collectors.fetch;

import java.net.URI;

public record FetchResponse(int status, String body, URI finalUri, boolean notModified) {
}

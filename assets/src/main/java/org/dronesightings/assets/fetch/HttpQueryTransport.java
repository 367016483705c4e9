/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.dronesightings.assets.fetch;

import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;

/**
 * {@link QueryTransport} over {@link HttpClient} issuing GET requests.
 *
 * <p>The query is sent URL-encoded in {@code queryParameter} (for example
 * {@code data} for Overpass, {@code query} for SPARQL). When no query parameter
 * is configured the endpoint is fetched as is, which suits static file sources.
 */
public class HttpQueryTransport implements QueryTransport {
  private static final Logger LOGGER = LoggerFactory.getLogger(HttpQueryTransport.class);

  static final String DEFAULT_USER_AGENT = "DroneSightings-Assets/1.0";
  private static final int ERROR_BODY_PREFIX = 200;

  private final HttpClient httpClient;
  private final @Nullable String queryParameter;
  private final ImmutableMap<String, String> extraParameters;
  private final @Nullable String accept;

  public HttpQueryTransport(@Nullable String queryParameter,
      Map<String, String> extraParameters, @Nullable String accept) {
    this(HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(30))
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build(),
        queryParameter, extraParameters, accept);
  }

  public HttpQueryTransport(HttpClient httpClient, @Nullable String queryParameter,
      Map<String, String> extraParameters, @Nullable String accept) {
    this.httpClient = httpClient;
    this.queryParameter = queryParameter;
    this.extraParameters = ImmutableMap.copyOf(extraParameters);
    this.accept = accept;
  }

  @Override public String send(String endpoint, String query, Duration timeout)
      throws IOException, InterruptedException {
    URI uri = buildUri(endpoint, query);
    HttpRequest.Builder request = HttpRequest.newBuilder(uri)
        .timeout(timeout)
        .header("User-Agent", DEFAULT_USER_AGENT)
        .GET();
    if (accept != null) {
      request.header("Accept", accept);
    }

    HttpResponse<String> response =
        httpClient.send(request.build(),
            HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
    int status = response.statusCode();
    LOGGER.debug("GET {} -> {}", endpoint, status);
    if (status < 200 || status >= 300) {
      String body = response.body() != null ? response.body() : "";
      throw new IOException("HTTP " + status + ": "
          + body.substring(0, Math.min(ERROR_BODY_PREFIX, body.length())));
    }
    return response.body();
  }

  /** Builds the request URI for an endpoint and query. */
  URI buildUri(String endpoint, String query) {
    StringBuilder url = new StringBuilder(endpoint);
    char separator = endpoint.contains("?") ? '&' : '?';
    if (queryParameter != null) {
      url.append(separator).append(queryParameter).append('=').append(encode(query));
      separator = '&';
    }
    for (Map.Entry<String, String> e : extraParameters.entrySet()) {
      url.append(separator).append(encode(e.getKey())).append('=').append(encode(e.getValue()));
      separator = '&';
    }
    return URI.create(url.toString());
  }

  private static String encode(String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8);
  }
}

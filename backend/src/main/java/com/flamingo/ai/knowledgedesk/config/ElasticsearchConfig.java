package com.flamingo.ai.knowledgedesk.config;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.json.jackson.JacksonJsonpMapper;
import co.elastic.clients.transport.ElasticsearchTransport;
import co.elastic.clients.transport.rest_client.RestClientTransport;
import org.apache.http.HttpHost;
import org.elasticsearch.client.RestClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Elasticsearch client used as the vector store. Connect and socket timeouts are bounded. */
@Configuration
public class ElasticsearchConfig {

  @Value("${elasticsearch.host:localhost}")
  private String host;

  @Value("${elasticsearch.port:9200}")
  private int port;

  @Value("${elasticsearch.scheme:http}")
  private String scheme;

  @Value("${elasticsearch.connect-timeout-ms:5000}")
  private int connectTimeoutMs;

  @Value("${elasticsearch.socket-timeout-ms:30000}")
  private int socketTimeoutMs;

  @Bean(destroyMethod = "close")
  public RestClient elasticsearchRestClient() {
    return RestClient.builder(new HttpHost(host, port, scheme))
        .setRequestConfigCallback(
            config -> config.setConnectTimeout(connectTimeoutMs).setSocketTimeout(socketTimeoutMs))
        .build();
  }

  @Bean
  public ElasticsearchTransport elasticsearchTransport(RestClient elasticsearchRestClient) {
    return new RestClientTransport(elasticsearchRestClient, new JacksonJsonpMapper());
  }

  @Bean
  public ElasticsearchClient elasticsearchClient(ElasticsearchTransport transport) {
    return new ElasticsearchClient(transport);
  }
}

package com.example.stats_api.repository;

import com.example.stats_api.config.ResultStoreProperties;
import com.example.stats_api.model.DispatchKey;
import com.example.stats_api.model.ResultDocument;
import com.example.stats_api.service.ResultStoreException;
import com.example.stats_api.service.StatsConfigurationException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.S3Exception;

@Repository
public class S3ResultDocumentRepository implements ResultDocumentRepository {

  private static final Logger logger = LoggerFactory.getLogger(S3ResultDocumentRepository.class);
  private static final TypeReference<LinkedHashMap<String, Object>> DOCUMENT_TYPE =
      new TypeReference<>() {};

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "S3Client は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final S3Client s3Client;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "ObjectMapper は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final ObjectMapper objectMapper;

  private final ResultStoreProperties properties;

  public S3ResultDocumentRepository(
      S3Client s3Client, ObjectMapper objectMapper, ResultStoreProperties properties) {
    this.s3Client = s3Client;
    this.objectMapper = objectMapper;
    this.properties = properties;
  }

  @Override
  public ResultDocument get(DispatchKey key) {
    if (properties.bucket().isBlank()) {
      throw new StatsConfigurationException("result store bucket is not configured");
    }
    final String objectKey = objectKey(key);
    final byte[] body = read(objectKey);
    return parse(body, objectKey);
  }

  /** {prefix}/{identifier}/{period}.json */
  public String objectKey(DispatchKey key) {
    return properties.keyPrefix()
        + "/"
        + key.identifier().value()
        + "/"
        + key.period().value()
        + ".json";
  }

  private byte[] read(String objectKey) {
    final GetObjectRequest request =
        GetObjectRequest.builder().bucket(properties.bucket()).key(objectKey).build();
    try {
      final ResponseBytes<GetObjectResponse> response = s3Client.getObjectAsBytes(request);
      return response.asByteArray();
    } catch (NoSuchKeyException ex) {
      throw new ResultStoreException(
          ResultStoreException.Reason.NOT_FOUND, "result object not found: " + objectKey, ex);
    } catch (S3Exception ex) {
      if (ex.statusCode() == 404) {
        throw new ResultStoreException(
            ResultStoreException.Reason.NOT_FOUND, "result object not found: " + objectKey, ex);
      }
      logger.warn(
          "result store read failed with status={} key={}", ex.statusCode(), objectKey, ex);
      throw new ResultStoreException(
          ResultStoreException.Reason.TRANSPORT, "result store read failed: " + objectKey, ex);
    } catch (SdkException ex) {
      logger.warn("result store read failed key={}", objectKey, ex);
      throw new ResultStoreException(
          ResultStoreException.Reason.TRANSPORT, "result store read failed: " + objectKey, ex);
    }
  }

  private ResultDocument parse(byte[] body, String objectKey) {
    final Map<String, Object> content;
    try {
      // 先頭の値の後ろに残りがあれば破損とみなす。
      content =
          objectMapper
              .readerFor(DOCUMENT_TYPE)
              .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
              .readValue(body);
    } catch (IOException ex) {
      logger.warn("result object is not a JSON object key={}", objectKey, ex);
      throw new ResultStoreException(
          ResultStoreException.Reason.DESERIALIZATION,
          "result object could not be parsed: " + objectKey,
          ex);
    }
    if (content == null) {
      throw new ResultStoreException(
          ResultStoreException.Reason.DESERIALIZATION, "result object is empty: " + objectKey);
    }
    return new ResultDocument(content);
  }
}

package com.scholary.pipeline.objectstore;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

import com.scholary.pipeline.objectstore.ObjectStoreClient.ObjectMetadata;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectResponse;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.S3Exception;

@ExtendWith(MockitoExtension.class)
class S3ObjectStoreClientTest {

  @Mock private S3Client s3Client;

  @Test
  void testGetObjectMetadata_MapsHeadResponse() {
    when(s3Client.headObject(any(HeadObjectRequest.class)))
        .thenReturn(HeadObjectResponse.builder().contentLength(2048L).contentType("audio/mpeg").build());

    ObjectMetadata metadata = new S3ObjectStoreClient(s3Client).getObjectMetadata("audio", "a.mp3");

    assertThat(metadata.contentLength()).isEqualTo(2048L);
    assertThat(metadata.contentType()).isEqualTo("audio/mpeg");
  }

  @Test
  void testGetObjectStream_MissingKeyBecomesObjectStoreException() {
    when(s3Client.getObject(any(GetObjectRequest.class)))
        .thenThrow(NoSuchKeyException.builder().message("missing").build());

    assertThatThrownBy(() -> new S3ObjectStoreClient(s3Client).getObjectStream("audio", "a.mp3"))
        .isInstanceOf(ObjectStoreException.class)
        .hasMessageContaining("Object not found");
  }

  @Test
  void testGetObjectMetadata_ServiceErrorBecomesObjectStoreException() {
    when(s3Client.headObject(any(HeadObjectRequest.class)))
        .thenThrow(S3Exception.builder().statusCode(403).message("denied").build());

    assertThatThrownBy(() -> new S3ObjectStoreClient(s3Client).getObjectMetadata("audio", "a.mp3"))
        .isInstanceOf(ObjectStoreException.class)
        .hasMessageContaining("statusCode=403");
  }
}

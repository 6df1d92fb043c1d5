package com.tablescan;

import com.google.api.gax.core.FixedCredentialsProvider;
import com.google.auth.oauth2.GoogleCredentials;
import com.google.cloud.vision.v1.AnnotateImageRequest;
import com.google.cloud.vision.v1.AnnotateImageResponse;
import com.google.cloud.vision.v1.BatchAnnotateImagesResponse;
import com.google.cloud.vision.v1.Feature;
import com.google.cloud.vision.v1.Image;
import com.google.cloud.vision.v1.ImageAnnotatorClient;
import com.google.cloud.vision.v1.ImageAnnotatorSettings;
import com.google.protobuf.ByteString;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;

/**
 * Google Cloud Vision {@code DOCUMENT_TEXT_DETECTION} on one cell image.
 *
 * <p>Credentials come from {@code GOOGLE_CREDENTIALS_JSON} (raw JSON or base64) when set,
 * otherwise from the application default credentials. The client is created on first use
 * and shared by all recognition threads.
 */
public class VisionTextRecognizer implements TextRecognizer, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(VisionTextRecognizer.class);

    private volatile ImageAnnotatorClient client;

    @Override
    public String recognize(BufferedImage cellImage) throws IOException {
        Image image = Image.newBuilder().setContent(ByteString.copyFrom(toPng(cellImage))).build();
        Feature feature = Feature.newBuilder().setType(Feature.Type.DOCUMENT_TEXT_DETECTION).build();
        AnnotateImageRequest request = AnnotateImageRequest.newBuilder()
                .addFeatures(feature)
                .setImage(image)
                .build();

        BatchAnnotateImagesResponse response = client().batchAnnotateImages(List.of(request));
        for (AnnotateImageResponse res : response.getResponsesList()) {
            if (res.hasError()) {
                throw new IOException("Vision API error: " + res.getError().getMessage());
            }
            if (res.hasFullTextAnnotation()) {
                return res.getFullTextAnnotation().getText();
            }
        }
        return "";
    }

    private ImageAnnotatorClient client() throws IOException {
        ImageAnnotatorClient current = client;
        if (current == null) {
            synchronized (this) {
                current = client;
                if (current == null) {
                    current = createVisionClient();
                    client = current;
                }
            }
        }
        return current;
    }

    private static ImageAnnotatorClient createVisionClient() throws IOException {
        String credentialsJson = System.getenv("GOOGLE_CREDENTIALS_JSON");

        if (credentialsJson != null && !credentialsJson.isEmpty()) {
            credentialsJson = credentialsJson.trim().replaceAll("\\s+", "");

            GoogleCredentials credentials;
            if (credentialsJson.startsWith("{")) {
                log.info("Loading Google credentials from GOOGLE_CREDENTIALS_JSON (raw JSON)");
                credentials = GoogleCredentials.fromStream(
                        new ByteArrayInputStream(credentialsJson.getBytes(StandardCharsets.UTF_8)));
            } else {
                log.info("Loading Google credentials from GOOGLE_CREDENTIALS_JSON (base64)");
                byte[] decoded;
                try {
                    decoded = Base64.getDecoder().decode(credentialsJson);
                } catch (IllegalArgumentException e) {
                    throw new IOException("GOOGLE_CREDENTIALS_JSON is neither JSON nor base64", e);
                }
                credentials = GoogleCredentials.fromStream(new ByteArrayInputStream(decoded));
            }

            ImageAnnotatorSettings settings = ImageAnnotatorSettings.newBuilder()
                    .setCredentialsProvider(FixedCredentialsProvider.create(credentials))
                    .build();
            return ImageAnnotatorClient.create(settings);
        }

        log.warn("No GOOGLE_CREDENTIALS_JSON found, using application default credentials");
        return ImageAnnotatorClient.create();
    }

    private static byte[] toPng(BufferedImage image) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        if (!ImageIO.write(image, "png", out)) {
            throw new IOException("No PNG writer for image type " + image.getType());
        }
        return out.toByteArray();
    }

    @Override
    public synchronized void close() {
        if (client != null) {
            client.close();
            client = null;
        }
    }
}

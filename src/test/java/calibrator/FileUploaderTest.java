package calibrator;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;

final class FileUploaderTest {

    @TempDir
    Path tempDir;

    private Path queueDir;
    private MockWebServer server;
    private FileUploader uploader;

    @BeforeEach
    void setUp() throws Exception {
        queueDir = tempDir.resolve("queue");
        assertTrue(FileUploader.createQueueDir(queueDir));
        server = new MockWebServer();
        server.start();
    }

    @AfterEach
    void tearDown() throws Exception {
        if (uploader != null) {
            uploader.close();
        }
        server.shutdown();
    }

    @Test
    void createsNestedQueueDirectory() {
        var nested = tempDir.resolve("a").resolve("b").resolve("c");
        assertTrue(FileUploader.createQueueDir(nested));
        assertTrue(Files.isDirectory(nested));
        assertTrue(FileUploader.createQueueDir(nested), "already there is fine");
    }

    @Test
    void uploadsQueuedFilesAndDeletesThem() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200));
        server.enqueue(new MockResponse().setResponseCode(200));
        Path first = queue("100000", "first parameters");
        Path second = queue("100001", "second parameters");

        uploader = newUploader(Duration.ofSeconds(9));
        uploader.tickle();
        var status = awaitIdle();

        assertEquals("Uploaded 2 files", status.message());
        assertEquals(UploadStatus.State.IDLE, status.state());
        assertFalse(Files.exists(first));
        assertFalse(Files.exists(queueDir.resolve("100000-index.upload")));
        assertFalse(Files.exists(second));
        assertEquals(2, server.getRequestCount());

        RecordedRequest request = server.takeRequest(5, TimeUnit.SECONDS);
        assertEquals("POST", request.getMethod());
        assertTrue(request.getHeader("Content-Type").startsWith("multipart/form-data"));
        String body = request.getBody().readString(StandardCharsets.UTF_8);
        assertTrue(body.contains("name=\"device_id\""));
        assertTrue(body.contains("cam0"));
        assertTrue(body.contains("filename=\"100000-camera_para.json\""));
        assertTrue(body.contains("application/octet-stream"));
        assertTrue(body.contains("first parameters"));
        assertFalse(body.contains("a comment"));
    }

    @Test
    void serverErrorPostponesAndKeepsTheFiles() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(500));
        Path parameters = queue("100000", "parameters");

        uploader = newUploader(Duration.ofSeconds(9));
        uploader.tickle();
        var status = awaitIdle();

        assertEquals("Server error while uploading. Uploads postponed.", status.message());
        assertTrue(Files.exists(parameters));
        assertTrue(Files.exists(queueDir.resolve("100000-index.upload")));
    }

    @Test
    void unreachableServerIsANetworkError() throws Exception {
        queue("100000", "parameters");
        var stopped = new MockWebServer();
        stopped.start();
        String url = stopped.url("/upload").toString();
        stopped.shutdown();

        uploader = new FileUploader(queueDir, "upload", url, Duration.ofSeconds(9));
        uploader.tickle();

        assertEquals("Network error while uploading. Uploads postponed.", awaitIdle().message());
    }

    @Test
    void indexWithoutFieldsIsAnInternalError() throws Exception {
        Files.writeString(queueDir.resolve("100000-index.upload"), "# only a comment\n\n");

        uploader = newUploader(Duration.ofSeconds(9));
        uploader.tickle();

        assertEquals("Internal error while uploading. Uploads postponed.", awaitIdle().message());
        assertEquals(0, server.getRequestCount());
    }

    @Test
    void emptyQueueShowsNothing() throws Exception {
        uploader = newUploader(Duration.ofSeconds(9));
        uploader.tickle();

        Await.until(() -> server.getRequestCount() == 0 && ! isBusy(), "pass over empty queue");
        assertEquals(UploadStatus.State.NONE, uploader.status(Instant.now()).state());
    }

    @Test
    void finalStatusHidesAfterTheConfiguredTime() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200));
        queue("100000", "parameters");

        uploader = newUploader(Duration.ofSeconds(9));
        uploader.tickle();
        awaitIdle();

        assertEquals(UploadStatus.State.IDLE, uploader.status(Instant.now()).state());
        assertEquals(UploadStatus.State.NONE, uploader.status(Instant.now().plusSeconds(10)).state());
        assertEquals(UploadStatus.State.NONE, uploader.status(Instant.now()).state(), "stays hidden");
    }

    @Test
    void tickleWhileUploadingRescansTheQueue() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200).setBodyDelay(300, TimeUnit.MILLISECONDS));
        server.enqueue(new MockResponse().setResponseCode(200));
        queue("100000", "first");

        uploader = newUploader(Duration.ofSeconds(9));
        uploader.tickle();
        Await.until(() -> server.getRequestCount() == 1, "first upload under way");
        Path late = queue("100001", "late");
        uploader.tickle();

        Await.until(() -> {
            uploader.status(Instant.now());
            return ! Files.exists(late);
        }, "late file uploaded");
        assertEquals(2, server.getRequestCount());
    }

    private FileUploader newUploader(Duration hideAfter) {
        return new FileUploader(queueDir, "upload", server.url("/upload").toString(), hideAfter);
    }

    private boolean isBusy() {
        return uploader.status(Instant.now()).state() == UploadStatus.State.BUSY;
    }

    private UploadStatus awaitIdle() {
        var last = new AtomicReference<UploadStatus>();
        Await.until(() -> {
            last.set(uploader.status(Instant.now()));
            return last.get().state() == UploadStatus.State.IDLE;
        }, "upload pass to finish");
        return last.get();
    }

    // parameter file and its index, the way the result saver writes them
    private Path queue(String id, String contents) throws Exception {
        Path parameters = queueDir.resolve(id + "-camera_para.json");
        Files.writeString(parameters, contents);
        Files.writeString(queueDir.resolve(id + "-index.upload"),
            "# a comment\n"
            + "version,1\n"
            + "file," + parameters.toAbsolutePath() + "\n"
            + "\n"
            + "device_id,cam0\n"
            + "err_avg,0.250000\n");
        return parameters;
    }
}

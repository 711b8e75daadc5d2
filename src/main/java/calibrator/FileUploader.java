package calibrator;

import java.io.IOException;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.apache.commons.lang3.StringUtils;

import okhttp3.MediaType;
import okhttp3.MultipartBody;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/*                                                                                                 */
/*                                     FileUploader class                                          */
/*                                     FileUploader class                                          */
/*                                     FileUploader class                                          */
/*                                                                                                 */
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/**
 * Posts queued files to a web form on its own thread.
 *
 * The queue is a directory. Each upload is described by an index file, named with the
 * index extension, of "key,value" lines; '#' lines and blank lines are ignored. Every
 * pair becomes a form field except the key "file", whose value is the path of a file
 * attached to the form. After the server answers 200 the index file and the attached
 * file are deleted. Any failure stops processing until the next tickle().
 */
public class FileUploader implements AutoCloseable
{
    private static Logger LOGGER;
    static {
      LOGGER = Logger.getLogger("");
      LOGGER.finer("Loading");
    }

    private static final MediaType OCTET_STREAM = MediaType.parse("application/octet-stream");

    private enum UploadError
    {
        NONE(""),
        NO_INTERNET("No Internet access. Uploads postponed."),
        NETWORK("Network error while uploading. Uploads postponed."),
        SERVER("Server error while uploading. Uploads postponed."),
        INTERNAL("Internal error while uploading. Uploads postponed.");

        private final String message;

        UploadError(String message)
        {
            this.message = message;
        }
    }

    private final Path queueDir;
    private final String indexExtension;
    private final String formPostUrl;
    private final Duration statusHideAfter;
    private final OkHttpClient httpClient;
    private final BackgroundWorker worker;
    private final AtomicBoolean rescanRequested = new AtomicBoolean(false);

    private final Object statusLock = new Object();
    // guarded by statusLock
    private String statusMessage = "";
    private boolean statusHide = false;
    private Instant statusHideAt = Instant.MAX;

    /**
     * Start the uploader thread; nothing is uploaded until tickle()
     * @param queueDir directory holding the index files
     * @param indexExtension extension of index files, without the dot
     * @param formPostUrl where to post
     * @param statusHideAfter how long the final status of a cycle stays visible
     */
    public FileUploader(Path queueDir, String indexExtension, String formPostUrl, Duration statusHideAfter)
    {
        this(queueDir, indexExtension, formPostUrl, statusHideAfter,
            new OkHttpClient.Builder()
                .connectTimeout(Cfg.uploadConnectTimeoutMillis, TimeUnit.MILLISECONDS)
                .readTimeout(Cfg.uploadReadTimeoutMillis, TimeUnit.MILLISECONDS)
                .build());
    }

    FileUploader(Path queueDir, String indexExtension, String formPostUrl, Duration statusHideAfter, OkHttpClient httpClient)
    {
        this.queueDir = queueDir;
        this.indexExtension = "." + StringUtils.removeStart(indexExtension, ".");
        this.formPostUrl = formPostUrl;
        this.statusHideAfter = statusHideAfter;
        this.httpClient = httpClient;
        this.worker = new BackgroundWorker("fileUploader", this::uploadQueue);
        LOGGER.config("uploading " + queueDir + "/*" + this.indexExtension + " to " + formPostUrl);
    }

    /**
     * Create the queue directory and any missing parents
     * @param queueDir directory
     * @return false if it could not be created
     */
    public static boolean createQueueDir(Path queueDir)
    {
        try {
            Files.createDirectories(queueDir);
            LOGGER.fine("queue directory " + queueDir + " OK");
            return true;
        } catch (IOException e) {
            LOGGER.log(Level.SEVERE, "Error creating queue directory " + queueDir, e);
            return false;
        }
    }

    /**
     * Start a pass over the queue. If a pass is running another is made after it.
     * Never blocks.
     */
    public void tickle()
    {
        if (worker.pollComplete())
        {
            worker.await(); // collect the last pass
        }
        if ( ! worker.submit())
        {
            rescanRequested.set(true);
        }
    }

    /**
     * Status for display
     * @param now current time, for hiding the final message of a pass
     * @return status
     */
    public UploadStatus status(Instant now)
    {
        if (worker.pollComplete())
        {
            worker.await();
            if (rescanRequested.getAndSet(false))
            {
                worker.submit();
            }
        }

        synchronized (statusLock)
        {
            if (statusMessage.isEmpty())
            {
                return UploadStatus.NONE;
            }
            if (statusHide && ! now.isBefore(statusHideAt))
            {
                statusMessage = "";
                statusHide = false;
                return UploadStatus.NONE;
            }
            return new UploadStatus(worker.isBusy() ? UploadStatus.State.BUSY : UploadStatus.State.IDLE, statusMessage);
        }
    }

    @Override
    public void close()
    {
        worker.close();
        httpClient.dispatcher().executorService().shutdown();
        httpClient.connectionPool().evictAll();
    }

    private void setStatus(String message)
    {
        synchronized (statusLock)
        {
            statusMessage = message;
            statusHide = false;
        }
    }
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/*                                                                                                 */
/*                                     uploadQueue                                                 */
/*                                     uploadQueue                                                 */
/*                                     uploadQueue                                                 */
/*                                                                                                 */
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
    // runs on the uploader thread
    private void uploadQueue()
    {
        do {
            uploadPass();
        } while (rescanRequested.getAndSet(false));
    }

    private void uploadPass()
    {
        setStatus("Looking for files to upload...");

        int uploadsDone = 0;
        UploadError error = UploadError.NONE;

        Path index;
        while ((index = nextIndexFile()) != null)
        {
            setStatus("Uploading file " + (uploadsDone + 1));
            error = upload(index);
            if (error != UploadError.NONE)
            {
                break;
            }
            uploadsDone++;
        }

        synchronized (statusLock)
        {
            statusHide = true;
            statusHideAt = Instant.now().plus(statusHideAfter);
            if (uploadsDone > 0)
            {
                statusMessage = "Uploaded " + uploadsDone + " file" + (uploadsDone > 1 ? "s" : "");
            }
            else if (error != UploadError.NONE)
            {
                statusMessage = error.message;
            }
            else
            {
                statusMessage = "";
                statusHide = false;
            }
        }
        LOGGER.info("upload pass done, " + uploadsDone + " uploaded" + (error != UploadError.NONE ? ", " + error : ""));
    }

    private Path nextIndexFile()
    {
        try (Stream<Path> files = Files.list(queueDir)) {
            return files
                .filter(path -> path.getFileName().toString().endsWith(indexExtension))
                .filter(Files::isRegularFile)
                .sorted()
                .findFirst()
                .orElse(null);
        } catch (IOException e) {
            LOGGER.log(Level.SEVERE, "Error reading queue directory " + queueDir, e);
            return null;
        }
    }

    private UploadError upload(Path index)
    {
        List<String> lines;
        try {
            lines = Files.readAllLines(index, StandardCharsets.UTF_8).stream()
                .map(String::strip)
                .filter(line -> ! line.isEmpty() && ! line.startsWith("#"))
                .collect(Collectors.toList());
        } catch (IOException e) {
            LOGGER.log(Level.SEVERE, "Error opening upload queue file " + index, e);
            return UploadError.INTERNAL;
        }

        MultipartBody.Builder form = new MultipartBody.Builder().setType(MultipartBody.FORM);
        Path attachment = null;
        int fields = 0;
        for (String line : lines)
        {
            String key = StringUtils.substringBefore(line, ",");
            if (key.length() == line.length())
            {
                continue; // no comma
            }
            String value = StringUtils.substringAfter(line, ",");
            if (key.equals("file"))
            {
                attachment = Path.of(value);
                if ( ! Files.isReadable(attachment))
                {
                    LOGGER.severe("Error reading file " + attachment + " named in " + index);
                    return UploadError.INTERNAL;
                }
                form.addFormDataPart(key, attachment.getFileName().toString(), RequestBody.create(attachment.toFile(), OCTET_STREAM));
            }
            else
            {
                form.addFormDataPart(key, value);
            }
            fields++;
        }
        if (fields == 0)
        {
            LOGGER.severe("Error reading form data from file " + index);
            return UploadError.INTERNAL;
        }

        Request request = new Request.Builder()
            .url(formPostUrl)
            .post(form.build())
            .build();

        try (Response response = httpClient.newCall(request).execute()) {
            if (response.code() != 200)
            {
                LOGGER.severe("Parameter file upload failed: server returned response " + response.code());
                return UploadError.SERVER;
            }
        } catch (UnknownHostException e) {
            LOGGER.warning("No Internet access " + e);
            return UploadError.NO_INTERNET;
        } catch (IOException e) {
            LOGGER.log(Level.SEVERE, "Error uploading " + index, e);
            return UploadError.NETWORK;
        }

        // uploaded OK so delete the index and the file it sent
        if ( ! deleteUploaded(index))
        {
            return UploadError.INTERNAL;
        }
        if (attachment != null)
        {
            deleteUploaded(attachment);
        }
        LOGGER.info("uploaded " + index.getFileName());
        return UploadError.NONE;
    }

    private static boolean deleteUploaded(Path path)
    {
        try {
            Files.deleteIfExists(path);
            return true;
        } catch (IOException e) {
            LOGGER.log(Level.SEVERE, "Error removing " + path + " after upload", e);
            return false;
        }
    }
}

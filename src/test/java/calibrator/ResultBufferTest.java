package calibrator;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import org.junit.jupiter.api.Test;
import org.opencv.core.Point;

final class ResultBufferTest {

    private static final int WIDTH = 16;
    private static final int HEIGHT = 8;
    private static final int FEATURES = 12;

    @Test
    void emptyBeforeFirstPublish() {
        var buffer = new ResultBuffer(WIDTH, HEIGHT);
        var result = buffer.lockAndFetch();
        try {
            assertFalse(result.foundAll());
            assertTrue(result.positions().isEmpty());
            assertNull(result.frame());
        } finally {
            buffer.unlock();
        }
        assertEquals(0, buffer.publishedCount());
    }

    @Test
    void publishCopiesPositionsAndPixels() {
        var buffer = new ResultBuffer(WIDTH, HEIGHT);
        var source = frame(7);
        var positions = new ArrayList<>(List.of(new Point(1, 2), new Point(3, 4)));

        buffer.publish(true, positions, source);
        positions.get(0).x = 99; // caller keeps using its objects
        Arrays.fill(source.pixels(), (byte) 8);

        var result = buffer.lockAndFetch();
        try {
            assertTrue(result.foundAll());
            assertEquals(2, result.positions().size());
            assertEquals(1., result.positions().get(0).x);
            assertEquals(7, result.frame().pixels()[0]);
        } finally {
            buffer.unlock();
        }
        assertEquals(1, buffer.publishedCount());
    }

    @Test
    void publishWaitsForReaderToUnlock() throws Exception {
        var buffer = new ResultBuffer(WIDTH, HEIGHT);
        buffer.publish(true, positions(1), frame(1));

        var published = new CountDownLatch(1);
        var result = buffer.lockAndFetch();
        try {
            var writer = new Thread(() -> {
                buffer.publish(false, List.of(), frame(2));
                published.countDown();
            });
            writer.start();
            assertFalse(published.await(100, TimeUnit.MILLISECONDS), "publish must wait for the reader");
            assertTrue(result.foundAll());
            assertEquals(1, result.frame().pixels()[0]);
        } finally {
            buffer.unlock();
        }
        assertTrue(published.await(5, TimeUnit.SECONDS));
    }

    @Test
    void readersNeverSeeMixedResultsUnderConcurrentPublishing() throws Exception {
        var buffer = new ResultBuffer(WIDTH, HEIGHT);
        var stop = new AtomicBoolean(false);
        var failures = new ConcurrentLinkedQueue<String>();

        // generation g: found with FEATURES positions at x = g when g is even, not found with none when odd;
        // every pixel holds g
        var writer = new Thread(() -> {
            for (int generation = 1; generation < 2000; generation++) {
                boolean found = generation % 2 == 0;
                buffer.publish(found, found ? positions(generation) : List.of(), frame(generation));
            }
            stop.set(true);
        });

        List<Thread> readers = new ArrayList<>();
        for (int r = 0; r < 3; r++) {
            readers.add(new Thread(() -> {
                while ( ! stop.get()) {
                    var result = buffer.lockAndFetch();
                    try {
                        if (result.frame() == null) {
                            continue;
                        }
                        byte pixel = result.frame().pixels()[0];
                        byte lastPixel = result.frame().pixels()[WIDTH*HEIGHT - 1];
                        if (pixel != lastPixel) {
                            failures.add("torn frame " + pixel + " " + lastPixel);
                        }
                        if (result.foundAll()) {
                            if (result.positions().size() != FEATURES) {
                                failures.add("found with " + result.positions().size() + " positions");
                            }
                            else if ((byte) result.positions().get(0).x != pixel) {
                                failures.add("positions of " + result.positions().get(0).x + " with frame " + pixel);
                            }
                        }
                        else if ( ! result.positions().isEmpty()) {
                            failures.add("not found with positions");
                        }
                    } finally {
                        buffer.unlock();
                    }
                }
            }));
        }

        readers.forEach(Thread::start);
        writer.start();
        writer.join(TimeUnit.SECONDS.toMillis(30));
        stop.set(true);
        for (Thread reader : readers) {
            reader.join(TimeUnit.SECONDS.toMillis(5));
        }

        assertTrue(failures.isEmpty(), () -> failures.size() + " inconsistencies, first " + failures.peek());
        assertEquals(1999, buffer.publishedCount());
    }

    private static FrameBuffer frame(int fill) {
        var frame = new FrameBuffer(WIDTH, HEIGHT);
        Arrays.fill(frame.pixels(), (byte) fill);
        return frame;
    }

    private static List<Point> positions(int x) {
        List<Point> positions = new ArrayList<>();
        for (int i = 0; i < FEATURES; i++) {
            positions.add(new Point(x, i));
        }
        return positions;
    }
}

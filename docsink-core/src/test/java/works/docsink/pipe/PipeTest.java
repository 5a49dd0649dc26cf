package works.docsink.pipe;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import works.docsink.errors.QueueErrorChannel;
import works.docsink.errors.SinkError;
import works.docsink.events.ChangeEvent;
import works.docsink.events.Delete;
import works.docsink.events.Insert;
import works.docsink.events.Update;

import static java.util.concurrent.TimeUnit.SECONDS;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static works.docsink.errors.ErrorLevel.ERROR;
import static works.docsink.logging.MdcKeys.ADAPTOR_PATH;

class PipeTest {
	final QueueErrorChannel errors = new QueueErrorChannel();
	final Pipe pipe = new Pipe("PipeTest/sink", errors);
	final ExecutorService executor = Executors.newSingleThreadExecutor();

	@AfterEach
	void shutdown() {
		executor.shutdownNow();
	}

	@Test
	void listen_deliversInOrderUntilStopped() throws InterruptedException {
		List<ChangeEvent> sent = List.of(
			new Insert(Map.of("id", "1")),
			new Update(Map.of("id", "1", "x", 2)),
			new Delete(Map.of("id", "1")));
		for (ChangeEvent event : sent) {
			pipe.send(event);
		}

		List<ChangeEvent> received = new ArrayList<>();
		pipe.listen(event -> {
			received.add(event);
			if (received.size() == sent.size()) {
				pipe.stop();
			}
			return event;
		});

		assertEquals(sent, received);
		assertTrue(pipe.isStopped());
		assertEquals(List.of(), errors.drain());
	}

	@Test
	void stop_leavesLaterEventsQueued() throws InterruptedException {
		pipe.send(new Insert(Map.of("id", "1")));
		pipe.send(new Insert(Map.of("id", "2")));

		List<ChangeEvent> received = new ArrayList<>();
		pipe.listen(event -> {
			received.add(event);
			pipe.stop();
			return event;
		});

		assertEquals(1, received.size());
		assertEquals(1, pipe.pending());
	}

	@Test
	void handlerThrows_reportedAndStreamContinues() throws InterruptedException {
		ChangeEvent bad = new Insert(Map.of("id", "bad"));
		ChangeEvent good = new Insert(Map.of("id", "good"));
		pipe.send(bad);
		pipe.send(good);

		List<ChangeEvent> handled = new ArrayList<>();
		pipe.listen(event -> {
			if (event == bad) {
				throw new IllegalStateException("expected test failure");
			}
			handled.add(event);
			pipe.stop();
			return event;
		});

		assertEquals(List.of(good), handled);
		List<SinkError> reported = errors.drain();
		assertEquals(1, reported.size());
		assertEquals(ERROR, reported.get(0).level());
		assertEquals("PipeTest/sink", reported.get(0).path());
		assertEquals(bad.payload(), reported.get(0).record());
	}

	@Test
	void listen_setsAdaptorPathInMdc() throws InterruptedException {
		pipe.send(new Insert(Map.of()));
		AtomicReference<String> pathSeen = new AtomicReference<>();
		pipe.listen(event -> {
			pathSeen.set(MDC.get(ADAPTOR_PATH));
			pipe.stop();
			return event;
		});
		assertEquals("PipeTest/sink", pathSeen.get());
		assertNull(MDC.get(ADAPTOR_PATH));
	}

	@Test
	void stopFromAnotherThread_listenReturns() throws Exception {
		Future<?> listener = executor.submit(() -> {
			pipe.listen(event -> event);
			return null;
		});
		pipe.send(new Insert(Map.of("id", "1")));
		pipe.stop();
		listener.get(5, SECONDS);
		assertTrue(pipe.isStopped());
	}
}

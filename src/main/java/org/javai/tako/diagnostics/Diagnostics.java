package org.javai.tako.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import org.javai.tako.token.Source;
import org.javai.tako.token.Location;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Collecting {@link MessageSink}. Every message is kept in arrival order and logged.
 */
public class Diagnostics implements MessageSink {

	private static final Logger logger = LoggerFactory.getLogger(Diagnostics.class);

	private final List<Message> messages = new ArrayList<>();

	@Override
	public void msg(Location location, Severity severity, String text) {
		Message message = new Message(location, severity, text);
		messages.add(message);
		switch (severity) {
			case ERROR -> logger.warn("{}: {}", location, message.text());
			case WARNING -> logger.info("{}: {}", location, message.text());
			case INFO -> logger.debug("{}: {}", location, message.text());
		}
	}

	public List<Message> messages() {
		return Collections.unmodifiableList(messages);
	}

	public boolean hasErrors() {
		return messages.stream().anyMatch(m -> m.severity() == Severity.ERROR);
	}

	/**
	 * Renders all messages as {@code file:line:column: severity: text}, one per line.
	 */
	public String format(Source source) {
		return messages.stream()
				.map(m -> format(source, m))
				.collect(Collectors.joining("\n"));
	}

	public static String format(Source source, Message message) {
		int offset = message.location().start();
		return message.location().sourceName()
				+ ":" + source.lineOf(offset)
				+ ":" + source.columnOf(offset)
				+ ": " + message.severity().label()
				+ ": " + message.text();
	}
}

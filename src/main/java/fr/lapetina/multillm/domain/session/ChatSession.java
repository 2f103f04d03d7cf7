package fr.lapetina.multillm.domain.session;

import fr.lapetina.multillm.domain.model.ChatMessage;
import fr.lapetina.multillm.domain.model.ModelDefinition;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One conversation with one configured model.
 *
 * Thread-safe. The busy flag admits one operation at a time; the transcript is only
 * appended to by the operation holding it, and readers always get a copy.
 */
public final class ChatSession {

    private final ModelDefinition model;
    private final List<TranscriptEntry> transcript = new ArrayList<>();
    private final AtomicBoolean busy = new AtomicBoolean(false);

    public ChatSession(ModelDefinition model) {
        this.model = Objects.requireNonNull(model, "Model is required");
    }

    public ModelDefinition model() {
        return model;
    }

    public String displayName() {
        return model.name();
    }

    public String provider() {
        return model.provider();
    }

    public boolean isBusy() {
        return busy.get();
    }

    /**
     * Moves the session from idle to busy.
     *
     * @return false when another operation is already in flight
     */
    boolean tryAcquire() {
        return busy.compareAndSet(false, true);
    }

    void release() {
        busy.set(false);
    }

    void append(TranscriptEntry entry) {
        synchronized (transcript) {
            transcript.add(entry);
        }
    }

    /**
     * Returns an immutable copy of the transcript, oldest first.
     */
    public List<TranscriptEntry> transcript() {
        synchronized (transcript) {
            return List.copyOf(transcript);
        }
    }

    /**
     * Conversational turns replayed to the provider, oldest first.
     */
    public List<ChatMessage> history() {
        List<ChatMessage> history = new ArrayList<>();
        for (TranscriptEntry entry : transcript()) {
            if (entry.isMessage()) {
                history.add(entry.toMessage());
            }
        }
        return history;
    }

    @Override
    public String toString() {
        return "ChatSession{model=" + model.name() + ", provider=" + model.provider() + ", busy=" + busy.get() + "}";
    }
}

package org.example.annotations.service;

import org.example.annotations.exception.AnnotationValidationException;
import org.example.annotations.model.Annotation;
import org.example.annotations.model.AnnotationDraft;
import org.example.annotations.model.Highlight;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * The local annotation set for each book, kept in insertion order. Annotations are immutable; every change replaces
 * the stored value, and {@link #list} hands out a snapshot so queries never see a mutation mid-pass.
 */
@Service
public class AnnotationService {

    private static final Logger log = LoggerFactory.getLogger(AnnotationService.class);

    private final Map<String, Map<String, Annotation>> annotationsByBook = new ConcurrentHashMap<>();
    private final Clock clock;

    public AnnotationService(Clock clock) {
        this.clock = clock;
    }

    public Annotation create(AnnotationDraft draft) {
        if (draft == null) {
            throw new AnnotationValidationException("Annotation input is required");
        }
        Annotation annotation = draft.toAnnotation(UUID.randomUUID().toString(), clock.instant());
        annotationsByBook.compute(annotation.bookId(), (bookId, book) -> {
            Map<String, Annotation> target = book == null ? new LinkedHashMap<>() : book;
            synchronized (target) {
                target.put(annotation.id(), annotation);
            }
            return target;
        });
        log.debug("Created {} {} in book {}", annotation.type().label(), annotation.id(), annotation.bookId());
        return annotation;
    }

    public List<Annotation> list(String bookId) {
        Map<String, Annotation> book = annotationsByBook.get(bookId);
        if (book == null) {
            return List.of();
        }
        synchronized (book) {
            return List.copyOf(book.values());
        }
    }

    public Optional<Annotation> find(String bookId, String id) {
        Map<String, Annotation> book = annotationsByBook.get(bookId);
        if (book == null) {
            return Optional.empty();
        }
        synchronized (book) {
            return Optional.ofNullable(book.get(id));
        }
    }

    /**
     * Applies every requested field as one change. The whole update is checked before anything is stored, so a
     * rejected update leaves the annotation untouched.
     */
    public Optional<Annotation> update(String bookId, String id, AnnotationUpdate update) {
        if (update == null) {
            throw new AnnotationValidationException("Annotation update is required");
        }
        return replace(bookId, id, annotation -> {
            if (update.color() != null && !(annotation instanceof Highlight)) {
                throw new AnnotationValidationException("Only highlights have a color");
            }
            Instant now = clock.instant();
            Annotation updated = annotation;
            if (update.note() != null) {
                updated = updated.withNote(update.note(), now);
            }
            if (update.color() != null) {
                updated = ((Highlight) updated).withColor(update.color(), now);
            }
            if (update.isPublic() != null) {
                updated = updated.withVisibility(update.isPublic(), now);
            }
            return updated;
        });
    }

    /**
     * Idempotent for the current user: liking twice counts once.
     */
    public Optional<Annotation> like(String bookId, String id) {
        return replace(bookId, id, annotation -> annotation.likedByCurrentUser()
                ? annotation
                : annotation.withLikes(annotation.likeCount() + 1, true));
    }

    public Optional<Annotation> unlike(String bookId, String id) {
        return replace(bookId, id, annotation -> annotation.likedByCurrentUser()
                ? annotation.withLikes(Math.max(0, annotation.likeCount() - 1), false)
                : annotation);
    }

    public boolean delete(String bookId, String id) {
        boolean[] removed = new boolean[1];
        annotationsByBook.computeIfPresent(bookId, (key, current) -> {
            synchronized (current) {
                removed[0] = current.remove(id) != null;
                return current.isEmpty() ? null : current;
            }
        });
        if (removed[0]) {
            log.debug("Deleted annotation {} from book {}", id, bookId);
        }
        return removed[0];
    }

    int bookCount() {
        return annotationsByBook.size();
    }

    private Optional<Annotation> replace(String bookId, String id, UnaryOperator<Annotation> change) {
        Map<String, Annotation> book = annotationsByBook.get(bookId);
        if (book == null) {
            return Optional.empty();
        }
        synchronized (book) {
            Annotation current = book.get(id);
            if (current == null) {
                return Optional.empty();
            }
            Annotation updated = change.apply(current);
            book.put(id, updated);
            return Optional.of(updated);
        }
    }
}

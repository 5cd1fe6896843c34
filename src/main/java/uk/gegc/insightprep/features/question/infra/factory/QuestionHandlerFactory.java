package uk.gegc.insightprep.features.question.infra.factory;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.insightprep.features.question.domain.model.QuestionType;
import uk.gegc.insightprep.features.question.infra.handler.QuestionHandler;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Component
@Slf4j
public class QuestionHandlerFactory {
    private final Map<QuestionType, QuestionHandler> handlerMap = new EnumMap<>(QuestionType.class);

    public QuestionHandlerFactory(List<QuestionHandler> handlers) {
        log.info("Initializing QuestionHandlerFactory with {} handlers", handlers.size());

        handlers.forEach(handler -> {
            QuestionType supportedType = handler.supportedType();
            QuestionHandler previous = handlerMap.put(supportedType, handler);
            if (previous != null) {
                throw new IllegalStateException("Duplicate handlers for type " + supportedType + ": "
                        + previous.getClass().getSimpleName() + ", " + handler.getClass().getSimpleName());
            }
        });

        log.info("QuestionHandlerFactory initialized with handlers for types: {}", handlerMap.keySet());
    }

    public Optional<QuestionHandler> findHandler(QuestionType type) {
        return type == null ? Optional.empty() : Optional.ofNullable(handlerMap.get(type));
    }
}

package projeto_planejador_backend.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import projeto_planejador_backend.config.PlannerProperties;
import projeto_planejador_backend.exceptions.ValidationException;
import projeto_planejador_backend.model.ConversationTurn;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class TranscriptValidator {

    private final PlannerProperties plannerProperties;

    public void validateForEvaluation(List<ConversationTurn> transcript) {
        if (transcript == null) {
            throw new ValidationException("A lista de mensagens é obrigatória.");
        }
        validateLimits(transcript);
    }

    public void validateForGeneration(List<ConversationTurn> transcript) {
        if (transcript == null || transcript.isEmpty()) {
            throw new ValidationException("Não há informações suficientes para gerar um plano. Descreva seu projeto primeiro.");
        }
        validateLimits(transcript);
        boolean hasUserTurn = transcript.stream()
                .anyMatch(turn -> turn.isFromUser() && !turn.getContent().isBlank());
        if (!hasUserTurn) {
            throw new ValidationException("A conversa precisa ter ao menos uma mensagem do usuário.");
        }
    }

    private void validateLimits(List<ConversationTurn> transcript) {
        int maxMessages = plannerProperties.getInput().getMaxMessages();
        if (transcript.size() > maxMessages) {
            log.warn("Transcript exceeds message limit: {} > {}", transcript.size(), maxMessages);
            throw new ValidationException(
                String.format("A conversa excede o limite de %d mensagens (encontradas: %d). Inicie uma nova conversa.",
                    maxMessages, transcript.size())
            );
        }

        int maxChars = plannerProperties.getInput().getMaxCharsPerMessage();
        for (int i = 0; i < transcript.size(); i++) {
            ConversationTurn turn = transcript.get(i);
            if (turn == null || turn.getRole() == null || turn.getContent() == null || turn.getContent().isBlank()) {
                throw new ValidationException(String.format("A mensagem %d está incompleta: papel e conteúdo são obrigatórios.", i + 1));
            }
            if (turn.getContent().length() > maxChars) {
                log.warn("Message exceeds character limit: {} > {}", turn.getContent().length(), maxChars);
                throw new ValidationException(
                    String.format("A mensagem %d excede o limite de %d caracteres (encontrados: %d). Por favor, encurte sua mensagem.",
                        i + 1, maxChars, turn.getContent().length())
                );
            }
        }
    }
}

package com.talentpilot.tracker.pipeline;

import com.talentpilot.tracker.model.Application;
import com.talentpilot.tracker.model.PipelineStage;
import com.talentpilot.tracker.model.StageTransition;
import com.talentpilot.tracker.repository.ApplicationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Funnel-stage moves for applications.
 *
 * Every move is checked against {@link StageModel} and appended to the
 * application's transition history in the same transaction.
 */
@Service
public class ApplicationStageService {

    private static final Logger log = LoggerFactory.getLogger(ApplicationStageService.class);

    private final ApplicationRepository applicationRepo;
    private final StageModel            stageModel;

    public ApplicationStageService(ApplicationRepository applicationRepo, StageModel stageModel) {
        this.applicationRepo = applicationRepo;
        this.stageModel      = stageModel;
    }

    @Transactional(readOnly = true)
    public Optional<Application> findById(UUID id) {
        return applicationRepo.findWithTransitionsById(id);
    }

    /**
     * Move the application to {@code target}, checked against the stage it has
     * under a row lock, not against whatever copy the caller read earlier.
     *
     * @return the moved application with its history loaded, or empty if the id is unknown
     * @throws IllegalStageTransitionException if the move goes backwards or leaves HIRED/REJECTED
     */
    @Transactional
    public Optional<Application> moveTo(UUID applicationId, PipelineStage target,
                                        String changedBy, String notes) {
        Optional<Application> locked = applicationRepo.findForUpdateById(applicationId);
        if (locked.isEmpty()) {
            return Optional.empty();
        }
        Application application = locked.get();
        PipelineStage current = application.getStage();
        if (!stageModel.canMove(current, target)) {
            throw new IllegalStageTransitionException(current, target);
        }
        StageTransition t = application.recordTransition(target, changedBy, notes);
        Application saved = applicationRepo.save(application);
        // Touch the history so it is loaded before the transaction ends.
        int moves = saved.getTransitions().size();
        log.info("Application {} moved {} → {} by {} ({} moves)",
                applicationId, t.getFromStage(), t.getToStage(), changedBy, moves);
        return Optional.of(saved);
    }

    /**
     * Funnel timeline for display. For a rejected application the furthest
     * stage reached is the one it was rejected from.
     */
    @Transactional(readOnly = true)
    public List<StageModel.TimelineEntry> timeline(Application application) {
        boolean rejected = application.getStage() == PipelineStage.REJECTED;
        PipelineStage reached = rejected ? stageBeforeRejection(application) : application.getStage();
        return stageModel.timeline(reached, rejected);
    }

    private static PipelineStage stageBeforeRejection(Application application) {
        List<StageTransition> history = application.getTransitions();
        for (int i = history.size() - 1; i >= 0; i--) {
            StageTransition t = history.get(i);
            if (t.getToStage() == PipelineStage.REJECTED && t.getFromStage() != null) {
                return t.getFromStage();
            }
        }
        return PipelineStage.SOURCING;
    }
}

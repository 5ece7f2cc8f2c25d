package com.example.clusteragent.session;

import com.example.clusteragent.agent.AgentMessage;
import com.example.clusteragent.agent.ModelJson;
import com.example.clusteragent.agent.ModelResponse;
import com.example.clusteragent.agent.ToolLoop;
import com.example.clusteragent.agent.ToolPolicyEngine;
import com.example.clusteragent.capability.CapabilityIndex;
import com.example.clusteragent.capability.CapabilityRecord;
import com.example.clusteragent.capability.CapabilitySearchFilters;
import com.example.clusteragent.capability.ScoredCapability;
import com.example.clusteragent.cluster.ClusterContext;
import com.example.clusteragent.config.AgentProperties;
import com.example.clusteragent.deploy.DeployOperation;
import com.example.clusteragent.deploy.DeploymentResult;
import com.example.clusteragent.error.AgentException;
import com.example.clusteragent.error.ErrorKind;
import com.example.clusteragent.error.InvalidRequestException;
import com.example.clusteragent.validation.ManifestValidationResult;
import com.example.clusteragent.validation.ManifestValidator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Clarifying → SolutionAssembled → AwaitingAnswers → ManifestGenerated → Deployed.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RecommendationWorkflow implements Workflow {

    private final CapabilityIndex capabilityIndex;
    private final ToolLoop toolLoop;
    private final PromptBuilder prompts;
    private final SolutionRanker solutionRanker;
    private final ManifestValidator manifestValidator;
    private final DeployOperation deployOperation;
    private final ToolPolicyEngine policyEngine;
    private final AutomationPolicy automationPolicy;
    private final SessionFiles sessionFiles;
    private final AgentProperties properties;
    private final ObjectMapper objectMapper;

    @Override
    public WorkflowKind kind() {
        return WorkflowKind.RECOMMENDATION;
    }

    @Override
    public void start(Session session) {
        SessionContext context = session.getContext();
        context.setCapabilityMatches(findCapabilities(context.getIntent()));

        ModelResponse response = toolLoop.callModel(
                prompts.clarification(context.getIntent(), context.getCapabilityMatches()), List.of());
        context.addUsage(response.usage());
        ClarificationAnswer answer = ModelJson.parse(objectMapper, response.content(), ClarificationAnswer.class);
        context.setClarificationQuestions(new ArrayList<>(answer.getQuestions()));
        log.info("Session {}: {} capability matches, {} clarification questions", session.getId(),
                context.getCapabilityMatches().size(), answer.getQuestions().size());
    }

    @Override
    public void advance(Session session, AdvanceRequest request) {
        AdvanceAction action = request.effectiveAction();
        switch (session.getPhase()) {
            case CLARIFYING -> {
                requireAction(session, action, AdvanceAction.CONTINUE);
                assembleSolutions(session, request.getClarification());
            }
            case SOLUTION_ASSEMBLED -> {
                requireAction(session, action, AdvanceAction.CONTINUE);
                chooseSolution(session, request.getSolutionId(), request.effectiveActor());
            }
            case AWAITING_ANSWERS -> {
                requireAction(session, action, AdvanceAction.CONTINUE);
                Map<String, Object> answers = checkAnswers(session, request.getAnswers());
                session.getContext().setAnswers(answers);
                generateManifest(session);
            }
            case MANIFEST_GENERATED -> {
                requireAction(session, action, AdvanceAction.CONTINUE, AdvanceAction.APPROVE, AdvanceAction.RETRY);
                deploy(session, request);
            }
            default -> throw new InvalidRequestException("Session " + session.getId() + " is " + session.getPhase()
                    + " and cannot be advanced");
        }
    }

    private List<ScoredCapability> findCapabilities(String query) {
        CapabilitySearchFilters filters = CapabilitySearchFilters.builder()
                .limit(properties.getWorkflow().getCapabilityMatches())
                .build();
        List<ScoredCapability> matches = capabilityIndex.search(query, filters);
        if (matches.isEmpty()) {
            throw AgentException.precondition("No indexed capability matches the intent; run a capability scan first");
        }
        return new ArrayList<>(matches);
    }

    void assembleSolutions(Session session, String clarification) {
        SessionContext context = session.getContext();
        if (clarification != null && !clarification.isBlank()) {
            context.getClarifications().add(clarification);
            String query = context.getIntent() + " " + String.join(" ", context.getClarifications());
            context.setCapabilityMatches(findCapabilities(query));
        }
        Map<String, CapabilityRecord> byName = new LinkedHashMap<>();
        for (ScoredCapability match : context.getCapabilityMatches()) {
            byName.put(match.record().getResourceName(), match.record());
        }

        int maxAttempts = properties.getWorkflow().getMaxSolutionAttempts();
        List<Solution> candidates = List.of();
        String lastProblem = "no solutions proposed";
        for (int attempt = 1; attempt <= maxAttempts && candidates.isEmpty(); attempt++) {
            ModelResponse response = toolLoop.callModel(
                    prompts.solutions(context.getIntent(), context.getClarifications(), context.getCapabilityMatches()),
                    List.of());
            context.addUsage(response.usage());
            try {
                SolutionsAnswer answer = ModelJson.parse(objectMapper, response.content(), SolutionsAnswer.class);
                candidates = usableSolutions(answer.getSolutions(), byName);
                if (candidates.isEmpty()) {
                    lastProblem = "no solution used an available capability with a positive score";
                }
            } catch (AgentException e) {
                if (e.getKind() != ErrorKind.VALIDATION) {
                    throw e;
                }
                lastProblem = e.getMessage();
            }
            if (candidates.isEmpty()) {
                log.warn("Session {}: solution attempt {}/{} unusable: {}", session.getId(), attempt, maxAttempts,
                        lastProblem);
            }
        }
        if (candidates.isEmpty()) {
            throw AgentException.validation("No scored solution after " + maxAttempts + " attempts: " + lastProblem);
        }

        List<Solution> ranked = new ArrayList<>(solutionRanker.rank(candidates, byName));
        context.setSolutions(ranked);
        session.transitionTo(Phase.SOLUTION_ASSEMBLED, "system", ranked.size() + " solutions");

        Solution best = ranked.get(0);
        AutomationDecision decision = automationPolicy.decide(context.getOptions(), best.getScore() / 100.0,
                best.getRisk());
        context.setAutomation(decision);
        if (decision.automatic() && hasSuggestedAnswers(best)) {
            log.info("Session {}: {}", session.getId(), decision.reason());
            chooseSolution(session, best.getId(), "automatic");
            context.setAnswers(suggestedAnswers(best));
            generateManifest(session);
        }
    }

    private static List<Solution> usableSolutions(List<Solution> proposed, Map<String, CapabilityRecord> byName) {
        List<Solution> usable = new ArrayList<>();
        for (Solution solution : proposed) {
            if (solution.getResources() == null) {
                continue;
            }
            if (solution.getQuestions() == null) {
                solution.setQuestions(new ArrayList<>());
            }
            List<String> known = solution.getResources().stream().filter(byName::containsKey).toList();
            if (known.isEmpty() || solution.getScore() <= 0) {
                continue;
            }
            solution.setResources(new ArrayList<>(known));
            solution.setId(Ids.next("sol"));
            int index = 1;
            for (Question question : solution.getQuestions()) {
                if (question.getId() == null || question.getId().isBlank()) {
                    question.setId("q" + index);
                }
                index++;
            }
            usable.add(solution);
        }
        return usable;
    }

    private void chooseSolution(Session session, String solutionId, String actor) {
        SessionContext context = session.getContext();
        String chosen = solutionId != null && !solutionId.isBlank() ? solutionId : context.getSolutions().get(0).getId();
        if (context.getSolutions().stream().noneMatch(s -> s.getId().equals(chosen))) {
            throw new InvalidRequestException("Unknown solution " + chosen + " for session " + session.getId());
        }
        context.setSelectedSolutionId(chosen);
        session.transitionTo(Phase.AWAITING_ANSWERS, actor, "solution " + chosen);
    }

    private Map<String, Object> checkAnswers(Session session, Map<String, Object> supplied) {
        Solution solution = session.getSelectedSolution()
                .orElseThrow(() -> AgentException.internal("Session " + session.getId() + " has no selected solution", null));
        Map<String, Object> answers = new LinkedHashMap<>(session.getContext().getAnswers());
        if (supplied != null) {
            answers.putAll(supplied);
        }

        List<String> problems = new ArrayList<>();
        Map<String, Question> questions = new LinkedHashMap<>();
        solution.getQuestions().forEach(q -> questions.put(q.getId(), q));
        for (String id : answers.keySet()) {
            if (!questions.containsKey(id)) {
                problems.add("unknown question '" + id + "'");
            }
        }
        for (Question question : questions.values()) {
            Object value = answers.get(question.getId());
            if (value == null || value.toString().isBlank()) {
                if (question.isRequired()) {
                    problems.add("required question '" + question.getId() + "' is unanswered");
                }
                continue;
            }
            String problem = checkType(question, value);
            if (problem != null) {
                problems.add(problem);
            }
        }
        if (!problems.isEmpty()) {
            throw new InvalidRequestException("Invalid answers: " + String.join("; ", problems));
        }
        return answers;
    }

    private static String checkType(Question question, Object value) {
        String id = question.getId();
        QuestionType type = question.getType() != null ? question.getType() : QuestionType.TEXT;
        List<String> options = question.getOptions() != null ? question.getOptions() : List.of();
        switch (type) {
            case NUMBER -> {
                if (value instanceof Number) {
                    return null;
                }
                try {
                    Double.parseDouble(value.toString());
                    return null;
                } catch (NumberFormatException e) {
                    return "'" + id + "' must be a number";
                }
            }
            case BOOLEAN -> {
                boolean ok = value instanceof Boolean || "true".equalsIgnoreCase(value.toString())
                        || "false".equalsIgnoreCase(value.toString());
                return ok ? null : "'" + id + "' must be true or false";
            }
            case SELECT -> {
                if (!options.isEmpty() && !options.contains(value.toString())) {
                    return "'" + id + "' must be one of " + options;
                }
                return null;
            }
            case MULTISELECT -> {
                if (!(value instanceof List<?> selected)) {
                    return "'" + id + "' must be a list";
                }
                if (!options.isEmpty()) {
                    for (Object item : selected) {
                        if (!options.contains(String.valueOf(item))) {
                            return "'" + id + "' must only contain " + options;
                        }
                    }
                }
                return null;
            }
            default -> {
                return null;
            }
        }
    }

    private static boolean hasSuggestedAnswers(Solution solution) {
        return solution.getQuestions().stream()
                .filter(Question::isRequired)
                .allMatch(q -> q.getSuggestedAnswer() != null);
    }

    private static Map<String, Object> suggestedAnswers(Solution solution) {
        Map<String, Object> answers = new LinkedHashMap<>();
        for (Question question : solution.getQuestions()) {
            if (question.getSuggestedAnswer() != null) {
                answers.put(question.getId(), question.getSuggestedAnswer());
            }
        }
        return answers;
    }

    /**
     * Generate, validate, repair; bounded by the configured number of repair iterations.
     */
    void generateManifest(Session session) {
        SessionContext context = session.getContext();
        Solution solution = session.getSelectedSolution()
                .orElseThrow(() -> AgentException.internal("Session " + session.getId() + " has no selected solution", null));
        List<CapabilityRecord> resources = new ArrayList<>();
        for (String name : solution.getResources()) {
            capabilityIndex.getByName(name).ifPresent(resources::add);
        }
        ClusterContext clusterContext = ClusterContext.from(properties.getKubectl());

        int maxIterations = properties.getWorkflow().getMaxRepairIterations();
        String previous = null;
        String errors = null;
        for (int attempt = 1; attempt <= maxIterations; attempt++) {
            List<AgentMessage> messages = prompts.manifest(context.getIntent(), solution, resources,
                    context.getAnswers(), previous, errors);
            ModelResponse response = toolLoop.callModel(messages, List.of());
            context.addUsage(response.usage());

            String manifest = extractYaml(response.content());
            Path path = sessionFiles.writeManifest(session.getId(), attempt, manifest);
            ManifestValidationResult result = manifestValidator.validate(path, clusterContext);
            context.setManifestAttempts(attempt);
            context.setValidation(result);
            if (result.isValid()) {
                context.setManifest(manifest);
                context.setManifestPath(path.toString());
                session.transitionTo(Phase.MANIFEST_GENERATED, "system",
                        "valid after " + attempt + " attempt" + (attempt == 1 ? "" : "s"));
                return;
            }
            log.info("Session {}: manifest attempt {}/{} invalid ({} errors)", session.getId(), attempt,
                    maxIterations, result.getErrors().size());
            previous = manifest;
            errors = result.errorSummary();
        }
        throw AgentException.validation("Manifest did not pass validation after " + maxIterations
                + " attempts: " + errors);
    }

    private void deploy(Session session, AdvanceRequest request) {
        if (!session.hasRecordedApproval()) {
            session.recordApproval(request.effectiveActor(), request.getComment() != null ? request.getComment() : "deploy");
        }
        int seconds = request.getTimeoutSeconds() != null
                ? request.getTimeoutSeconds()
                : properties.getDeploy().getDefaultTimeoutSeconds();
        DeploymentResult result = deployOperation.deploy(sessionFiles.root(), session.getId(),
                Duration.ofSeconds(seconds), session.toolContext(), policyEngine.allowedRiskClasses(session));
        session.getContext().getDeployments().add(result);
        if (result.isApplyTimeout()) {
            log.warn("Session {}: deploy timed out and may have been applied, staying in {}: {}",
                    session.getId(), session.getPhase(), result.getError());
            session.addNote(request.effectiveActor(), "Deploy timed out; the manifest may still have been applied: "
                    + result.getError());
            return;
        }
        if (!result.isSuccess()) {
            log.warn("Session {}: deploy failed, staying in {}: {}", session.getId(), session.getPhase(), result.getError());
            return;
        }
        session.transitionTo(Phase.DEPLOYED, request.effectiveActor(),
                result.isReadinessTimeout() ? "applied; readiness timeout for " + result.getNotReady() : "applied and ready");
    }

    static String extractYaml(String content) {
        if (content == null || content.isBlank()) {
            throw AgentException.validation("Model returned no manifest");
        }
        int fence = content.indexOf("```");
        if (fence < 0) {
            return content.strip() + "\n";
        }
        int bodyStart = content.indexOf('\n', fence);
        int end = content.indexOf("```", bodyStart + 1);
        if (bodyStart < 0 || end < 0) {
            return content.substring(fence + 3).strip() + "\n";
        }
        return content.substring(bodyStart + 1, end).strip() + "\n";
    }

    private static void requireAction(Session session, AdvanceAction action, AdvanceAction... allowed) {
        for (AdvanceAction candidate : allowed) {
            if (candidate == action) {
                return;
            }
        }
        throw new InvalidRequestException("Action " + action + " is not valid in phase " + session.getPhase());
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ClarificationAnswer {
        private List<String> questions = new ArrayList<>();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SolutionsAnswer {
        private List<Solution> solutions = new ArrayList<>();
    }
}

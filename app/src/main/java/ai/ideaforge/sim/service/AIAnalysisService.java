package ai.ideaforge.sim.service;

import ai.ideaforge.sim.model.AnalysisResult;
import ai.ideaforge.sim.model.CategoryRecommendation;
import ai.ideaforge.sim.model.HealthReport;
import ai.ideaforge.sim.model.IdeaComparison;
import ai.ideaforge.sim.model.Language;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Scores and critiques ideas and hackathon projects.
 *
 * <p>Operations never throw: invalid input ({@link ValidationException}) and failures of the backing model
 * are both reported through {@link ServiceResult#failure(ServiceException)}.
 */
public interface AIAnalysisService {

    CompletableFuture<ServiceResult<AnalysisResult>> analyzeIdea(String idea, Language language);

    CompletableFuture<ServiceResult<AnalysisResult>> analyzeHackathonProject(String projectName,
                                                                             String description,
                                                                             String toolUsage,
                                                                             Language language);

    CompletableFuture<ServiceResult<List<String>>> getImprovementSuggestions(String idea, int currentScore, Language language);

    CompletableFuture<ServiceResult<IdeaComparison>> compareIdeas(String idea1, String idea2, Language language);

    CompletableFuture<ServiceResult<CategoryRecommendation>> recommendHackathonCategory(String projectName,
                                                                                        String description,
                                                                                        String toolUsage);

    CompletableFuture<ServiceResult<HealthReport>> healthCheck();
}

package ai.ideaforge.sim.service;

import ai.ideaforge.sim.model.FrankensteinElement;
import ai.ideaforge.sim.model.FrankensteinIdea;
import ai.ideaforge.sim.model.FrankensteinMode;
import ai.ideaforge.sim.model.Language;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Generates a mashup idea from two or more companies, products or AWS services.
 */
public interface FrankensteinService {

    int MIN_ELEMENTS = 2;

    /**
     * @throws ValidationException when fewer than {@link #MIN_ELEMENTS} elements are supplied
     */
    CompletableFuture<ServiceResult<FrankensteinIdea>> generateIdea(List<FrankensteinElement> elements,
                                                                   FrankensteinMode mode,
                                                                   Language language);
}

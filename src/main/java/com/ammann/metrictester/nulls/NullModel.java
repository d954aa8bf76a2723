/* (C)2026 */
package com.ammann.metrictester.nulls;

import com.ammann.metrictester.model.CommunityDataMatrix;
import com.ammann.metrictester.model.NullsInput;
import java.util.List;
import org.apache.commons.math3.random.RandomGenerator;

/**
 * A randomization procedure producing community data matrices consistent with a null
 * hypothesis. How many matrices one invocation returns is up to the model.
 *
 * <p>Implementations must draw randomness only from the supplied generator, which is owned by
 * the calling worker, and must not modify the input.
 */
@FunctionalInterface
public interface NullModel {

    List<CommunityDataMatrix> randomize(NullsInput input, RandomGenerator random);
}

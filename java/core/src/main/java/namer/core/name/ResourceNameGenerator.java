/*
 * Copyright 2022-2025 Crown Copyright
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package namer.core.name;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import namer.core.definition.ResourceDefinitions;
import namer.core.util.RandomSuffixGenerator;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Generates names for every resource type in a request. Validates the requested resource types, settles the random
 * suffix, then generates each name with the default precedence.
 */
public class ResourceNameGenerator {
    private static final Logger LOGGER = LoggerFactory.getLogger(ResourceNameGenerator.class);

    private final ResourceTypeValidator typeValidator;
    private final ResourceNameResolver resolver;
    private final Supplier<Instant> timeSupplier;

    public ResourceNameGenerator(ResourceDefinitions definitions) {
        this(definitions, Instant::now);
    }

    public ResourceNameGenerator(ResourceDefinitions definitions, Supplier<Instant> timeSupplier) {
        this.typeValidator = new ResourceTypeValidator(definitions);
        this.resolver = new ResourceNameResolver(definitions);
        this.timeSupplier = Objects.requireNonNull(timeSupplier, "timeSupplier must not be null");
    }

    /**
     * Generates names for the resource types in a request. Fails on the first name that cannot be generated.
     *
     * @param  request                         the request
     * @return                                 the generated names
     * @throws NoResourceTypeSelectedException if the request has no resource types
     * @throws ResourceTypesInvalidException   if any requested resource type is not in the catalog
     * @throws ResourceNameInvalidException    if a generated name fails validation for its resource type
     */
    public GeneratedResourceNames generate(ResourceNameRequest request) {
        typeValidator.validate(request.getResourceType(), request.getResourceTypes());
        long seed = request.getRandomSeed();
        if (seed == 0) {
            seed = ChronoUnit.MICROS.between(Instant.EPOCH, timeSupplier.get());
            LOGGER.debug("No random seed was set, generated seed {}", seed);
        }
        String randomString = request.getRandomString();
        if (randomString.isEmpty()) {
            randomString = RandomSuffixGenerator.randomSuffix(request.getRandomLength(), seed);
        }
        NamingParameters parameters = NamingParameters.builder()
                .separator(request.getSeparator())
                .prefixes(request.getPrefixes())
                .name(request.getName())
                .suffixes(request.getSuffixes())
                .randomSuffix(randomString)
                .cleanInput(request.isCleanInput())
                .passthrough(request.isPassthrough())
                .useSlug(request.isUseSlug())
                .precedence(NameComponent.DEFAULT_PRECEDENCE)
                .build();

        GeneratedResourceNames.Builder names = GeneratedResourceNames.builder()
                .randomSeed(seed)
                .randomString(randomString);
        if (!request.getResourceType().isEmpty()) {
            names.result(request.getResourceType(), resolver.resolveName(request.getResourceType(), parameters));
        }
        for (String resourceType : request.getResourceTypes()) {
            if (resourceType.isEmpty()) {
                continue;
            }
            names.name(resourceType, resolver.resolveName(resourceType, parameters));
        }
        return names.build();
    }
}

package com.jquest.api.core.resource;

import com.jquest.api.config.JquestProperties;
import com.jquest.api.core.domain.repository.ResourceRepository;
import com.jquest.api.domain.model.Account;
import com.jquest.api.domain.model.AuthToken;
import com.jquest.api.domain.model.Instance;
import com.jquest.api.domain.model.Language;
import com.jquest.api.domain.model.Mission;
import com.jquest.api.domain.model.MissionRelationship;
import com.jquest.api.domain.model.OAuthLink;
import com.jquest.api.domain.model.Post;
import com.jquest.api.domain.model.Progression;
import com.jquest.api.domain.repository.AccountRepository;
import com.jquest.api.domain.repository.AuthTokenRepository;
import com.jquest.api.domain.repository.InstanceRepository;
import com.jquest.api.domain.repository.LanguageRepository;
import com.jquest.api.domain.repository.MissionRelationshipRepository;
import com.jquest.api.domain.repository.MissionRepository;
import com.jquest.api.domain.repository.OAuthLinkRepository;
import com.jquest.api.domain.repository.PostRepository;
import com.jquest.api.domain.repository.ProgressionRepository;
import com.jquest.api.domain.resource.AccountResource;
import com.jquest.api.domain.resource.AuthTokenResource;
import com.jquest.api.domain.resource.InstanceResource;
import com.jquest.api.domain.resource.LanguageResource;
import com.jquest.api.domain.resource.MissionRelationshipResource;
import com.jquest.api.domain.resource.MissionResource;
import com.jquest.api.domain.resource.OAuthLinkResource;
import com.jquest.api.domain.resource.PostResource;
import com.jquest.api.domain.resource.ProgressionResource;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

import java.util.ArrayList;
import java.util.List;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Every domain resource wired to mocked repositories, for tests that run without a Spring context.
 */
public class TestResources {

    public final AccountRepository accountRepository = repository(AccountRepository.class, Account.class);
    public final OAuthLinkRepository oauthLinkRepository = repository(OAuthLinkRepository.class, OAuthLink.class);
    public final AuthTokenRepository authTokenRepository = repository(AuthTokenRepository.class, AuthToken.class);
    public final InstanceRepository instanceRepository = repository(InstanceRepository.class, Instance.class);
    public final MissionRepository missionRepository = repository(MissionRepository.class, Mission.class);
    public final MissionRelationshipRepository relationshipRepository =
            repository(MissionRelationshipRepository.class, MissionRelationship.class);
    public final ProgressionRepository progressionRepository =
            repository(ProgressionRepository.class, Progression.class);
    public final LanguageRepository languageRepository = repository(LanguageRepository.class, Language.class);
    public final PostRepository postRepository = repository(PostRepository.class, Post.class);

    public final AccountResource accounts =
            new AccountResource(progressionRepository, oauthLinkRepository, new BCryptPasswordEncoder());
    public final OAuthLinkResource oauthLinks = new OAuthLinkResource();
    public final AuthTokenResource tokens = new AuthTokenResource();
    public final InstanceResource instances = new InstanceResource(missionRepository);
    public final MissionResource missions = new MissionResource(relationshipRepository);
    public final MissionRelationshipResource relationships = new MissionRelationshipResource();
    public final ProgressionResource progressions = new ProgressionResource();
    public final LanguageResource languages = new LanguageResource();
    public final PostResource posts = new PostResource();

    private final List<ModelResource<?>> extraResources = new ArrayList<>();

    /**
     * Registers an additional resource, before {@link #registry()} is called.
     */
    public TestResources with(ModelResource<?> resource) {
        extraResources.add(resource);
        return this;
    }

    /**
     * Builds and initializes a registry bound to {@code /api/v1}.
     */
    public ResourceRegistry registry() {
        List<ModelResource<?>> resources = new ArrayList<>(List.of(accounts, oauthLinks, tokens, instances,
                missions, relationships, progressions, languages, posts));
        resources.addAll(extraResources);
        List<ResourceRepository<?>> repositories = List.of(accountRepository, oauthLinkRepository,
                authTokenRepository, instanceRepository, missionRepository, relationshipRepository,
                progressionRepository, languageRepository, postRepository);
        ResourceRegistry registry = new ResourceRegistry(resources, repositories, new JquestProperties());
        registry.init();
        return registry;
    }

    private static <R extends ResourceRepository<T>, T> R repository(Class<R> type, Class<T> entityClass) {
        R repository = mock(type);
        when(repository.getEntityClass()).thenReturn(entityClass);
        return repository;
    }
}

package com.jquest.api.core.resource;

import com.jquest.api.domain.model.Account;
import com.jquest.api.domain.model.Instance;
import com.jquest.api.domain.model.Language;
import com.jquest.api.domain.model.Mission;
import com.jquest.api.domain.model.MissionRelationship;
import com.jquest.api.domain.model.Post;
import com.jquest.api.domain.model.Progression;
import com.jquest.api.exception.RelationshipResolutionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@DisplayName("ResourceProjector Tests")
class ResourceProjectorTest {

    private static final String HOST = "http://testserver";

    private TestResources resources;
    private ResourceProjector projector;
    private Instance instance;
    private Mission mission;

    @BeforeEach
    void setUp() {
        resources = new TestResources();
        projector = new ResourceProjector(resources.registry());

        instance = new Instance();
        instance.setId(1L);
        instance.setName("Main");
        instance.setSlug("main");

        mission = new Mission();
        mission.setId(3L);
        mission.setName("First steps");
        mission.setImage("/media/missions/first.png");
        mission.setInstance(instance);

        when(resources.missionRepository.findByInstance(instance)).thenReturn(List.of(mission));
        when(resources.relationshipRepository.findByMission(mission)).thenReturn(List.of());
    }

    @Test
    @DisplayName("Should add detail-only fields when the path is the object's own URI")
    @SuppressWarnings("unchecked")
    void shouldRenderDetailFieldsOnDetailRequest() {
        // Given
        RequestContext request = new RequestContext("/api/v1/instance/1", HOST);

        // When
        Map<String, Object> data = projector.project(instance, request, resources.instances);

        // Then
        assertThat(data)
            .containsEntry("name", "Main")
            .containsEntry("resource_uri", "/api/v1/instance/1")
            .containsKey("missions");
        List<Map<String, Object>> missions = (List<Map<String, Object>>) data.get("missions");
        assertThat(missions).hasSize(1);
        assertThat(missions.get(0))
            .containsEntry("resource_uri", "/api/v1/mission/3")
            .containsEntry("instance", "/api/v1/instance/1")
            .containsEntry("image", "http://testserver/media/missions/first.png");
    }

    @Test
    @DisplayName("Should not add detail-only fields on a list request, even with a single member")
    void shouldOmitDetailFieldsOnListRequest() {
        // Given
        RequestContext request = new RequestContext("/api/v1/instance", HOST);

        // When
        Map<String, Object> data = projector.project(instance, request, resources.instances);

        // Then
        assertThat(data).doesNotContainKey("missions");
        assertThat(data.keySet()).containsExactly("id", "name", "slug", "host", "description", "resource_uri");
    }

    @Test
    @DisplayName("Should treat a path with a trailing slash as a list request")
    void shouldCompareDetailPathExactly() {
        // Given
        RequestContext request = new RequestContext("/api/v1/instance/1/", HOST);

        // When & Then
        assertThat(projector.isDetailRequest(instance, request, resources.instances)).isFalse();
        assertThat(projector.project(instance, request, resources.instances)).doesNotContainKey("missions");
    }

    @Test
    @DisplayName("Should not render detail fields of one object on another object's URI")
    void shouldOmitDetailFieldsForOtherObject() {
        // Given
        RequestContext request = new RequestContext("/api/v1/instance/2", HOST);

        // When
        Map<String, Object> data = projector.project(instance, request, resources.instances);

        // Then
        assertThat(data).doesNotContainKey("missions");
    }

    @Test
    @DisplayName("Should render the progression state label, or null for an unknown code")
    void shouldRenderStateLabel() {
        // Given
        Account user = new Account("alice");
        user.setId(5L);
        Progression progression = new Progression();
        progression.setId(9L);
        progression.setUser(user);
        progression.setMission(mission);
        progression.setState("in_progress");
        RequestContext request = new RequestContext("/api/v1/user_progression", HOST);

        // When
        Map<String, Object> known = projector.project(progression, request, resources.progressions);
        progression.setState("lost");
        Map<String, Object> unknown = projector.project(progression, request, resources.progressions);

        // Then
        assertThat(known)
            .containsEntry("state", "In progress")
            .containsEntry("mission", "/api/v1/mission/3")
            .containsEntry("user", "/api/v1/user/5");
        assertThat(unknown).containsEntry("state", null);
    }

    @Test
    @DisplayName("Should make the mission image absolute on the requested host")
    void shouldRenderAbsoluteImage() {
        // Given
        mission.setImage("/img/x.png");
        RequestContext request = new RequestContext("/api/v1/mission", "https://api.example.com");

        // When
        Map<String, Object> data = projector.project(mission, request, resources.missions);

        // Then
        assertThat(data).containsEntry("image", "https://api.example.com/img/x.png");
    }

    @Test
    @DisplayName("Should encode a stored mission image path containing spaces")
    void shouldRenderImageWithSpaces() {
        // Given
        mission.setImage("/media/missions/my picture.png");
        RequestContext request = new RequestContext("/api/v1/mission/3", "https://api.example.com");

        // When
        Map<String, Object> data = projector.project(mission, request, resources.missions);

        // Then
        assertThat(data).containsEntry("image", "https://api.example.com/media/missions/my%20picture.png");
    }

    @Test
    @DisplayName("Should let an override read fields dehydrated before it")
    void shouldPassSiblingFieldsToOverride() {
        // Given
        ModelResource<Language> labels = new ModelResource<>("language_label", Language.class) {
            {
                field(ResourceField.builder()
                        .name("label")
                        .readonly(true)
                        .extractor(bundle -> null)
                        .build());
                override("label", bundle -> bundle.getData().get("name") + " (" + bundle.getData().get("code") + ")");
            }
        };
        ResourceProjector labelProjector = new ResourceProjector(new TestResources().with(labels).registry());
        Language language = new Language();
        language.setId(2L);
        language.setCode("fr");
        language.setName("French");

        // When
        Map<String, Object> data = labelProjector.project(language, new RequestContext("/api/v1/language_label", HOST),
            labels);

        // Then
        assertThat(data)
            .containsEntry("code", "fr")
            .containsEntry("name", "French")
            .containsEntry("label", "French (fr)");
    }

    @Test
    @DisplayName("Should render a missing mission image as null")
    void shouldRenderMissingImageAsNull() {
        // Given
        mission.setImage("");
        RequestContext request = new RequestContext("/api/v1/mission/3", HOST);

        // When
        Map<String, Object> data = projector.project(mission, request, resources.missions);

        // Then
        assertThat(data).containsEntry("image", null);
    }

    @Test
    @DisplayName("Should render nested relationships as full objects with URIs")
    @SuppressWarnings("unchecked")
    void shouldRenderFullToManyRelation() {
        // Given
        Mission parent = new Mission();
        parent.setId(2L);
        parent.setInstance(instance);
        MissionRelationship relationship = new MissionRelationship();
        relationship.setId(11L);
        relationship.setParent(parent);
        relationship.setMission(mission);
        when(resources.relationshipRepository.findByMission(mission)).thenReturn(List.of(relationship));

        // When
        Map<String, Object> data = projector.project(mission, new RequestContext("/api/v1/mission", HOST),
            resources.missions);

        // Then
        List<Map<String, Object>> relationships = (List<Map<String, Object>>) data.get("relationships");
        assertThat(relationships).hasSize(1);
        assertThat(relationships.get(0))
            .containsEntry("parent", "/api/v1/mission/2")
            .containsEntry("mission", "/api/v1/mission/3")
            .containsEntry("resource_uri", "/api/v1/mission_relationship/11");
    }

    @Test
    @DisplayName("Should render an empty nullable to-one relation as null")
    void shouldRenderNullableRelationAsNull() {
        // Given
        Post post = new Post();
        post.setId(4L);
        post.setTitle("Welcome");

        // When
        Map<String, Object> data = projector.project(post, new RequestContext("/api/v1/post", HOST),
            resources.posts);

        // Then
        assertThat(data).containsEntry("language", null);
    }

    @Test
    @DisplayName("Should fail when a required to-one relation is empty")
    void shouldFailOnMissingRequiredRelation() {
        // Given
        mission.setInstance(null);

        // When & Then
        assertThatThrownBy(() -> projector.project(mission, new RequestContext("/api/v1/mission", HOST),
            resources.missions))
            .isInstanceOf(RelationshipResolutionException.class)
            .hasMessageContaining("instance");
    }

    @Test
    @DisplayName("Should fail when a relation points to an unregistered resource")
    void shouldFailOnUnknownRelatedResource() {
        // Given
        ModelResource<Post> drafts = new ModelResource<>("post_draft", Post.class) {
            {
                field(ResourceField.toOne("language", "language", "dialect", false));
            }
        };
        TestResources withDrafts = new TestResources().with(drafts);
        ResourceProjector draftProjector = new ResourceProjector(withDrafts.registry());
        Post post = new Post();
        post.setId(4L);
        post.setLanguage(new Language());

        // When & Then
        assertThatThrownBy(() -> draftProjector.project(post, new RequestContext("/api/v1/post_draft", HOST),
            drafts))
            .isInstanceOf(RelationshipResolutionException.class)
            .hasMessageContaining("dialect");
    }
}

package club.ppmc.softpack.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.same;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import club.ppmc.softpack.config.SoftpackSettings;
import club.ppmc.softpack.model.CatalogPackage;
import club.ppmc.softpack.model.Environment;
import club.ppmc.softpack.model.EnvironmentInput;
import club.ppmc.softpack.model.EnvironmentResult.CreateEnvironmentSuccess;
import club.ppmc.softpack.model.EnvironmentResult.DeleteEnvironmentSuccess;
import club.ppmc.softpack.model.EnvironmentResult.InvalidInputError;
import club.ppmc.softpack.model.EnvironmentResult.RecipeSuccess;
import club.ppmc.softpack.model.EnvironmentState;
import club.ppmc.softpack.model.PackageSpec;
import club.ppmc.softpack.model.RecipeRequest;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class RecipeServiceTest {

    private static final RecipeRequest A_RECIPE =
            new RecipeRequest("a_recipe", "1.2", "a library", "https://example.com/a_recipe", "alice");

    @TempDir
    Path tempDir;

    private Path origin;
    private SoftpackSettings settings;
    private ArtifactStore store;
    private BuilderClient builderClient;
    private EmailNotifier emailNotifier;
    private PackageCatalogService catalogService;
    private EnvironmentService environmentService;
    private RecipeService recipeService;

    @BeforeEach
    void setUp() throws Exception {
        origin = TestRepositories.createOrigin(tempDir.resolve("origin.git"));
        settings = TestRepositories.settings(origin, tempDir.resolve("local"));
        store = TestRepositories.openStore(settings);
        builderClient = mock(BuilderClient.class);
        emailNotifier = mock(EmailNotifier.class);
        catalogService = mock(PackageCatalogService.class);
        var groups = new GroupService(new ConfiguredGroupDirectory(settings), settings);
        environmentService = new EnvironmentService(store, builderClient, groups, emailNotifier, settings);
        recipeService = new RecipeService(store, environmentService, catalogService, emailNotifier, settings);
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    private Environment environment(String name) {
        return environmentService.get("users/alice", name).orElseThrow();
    }

    private String createWaiting(PackageSpec... recipes) {
        var packages = new ArrayList<PackageSpec>();
        packages.add(PackageSpec.parse("zlib@1.3.1"));
        packages.addAll(List.of(recipes));
        var result = environmentService.create(new EnvironmentInput("myenv", "users/alice", "my env", packages, "alice"));
        assertThat(result).isInstanceOf(CreateEnvironmentSuccess.class);
        return ((CreateEnvironmentSuccess) result).name();
    }

    @Test
    void requestIsStoredAndMailedToRecipeAdmins() throws Exception {
        assertThat(recipeService.request(A_RECIPE)).isEqualTo(new RecipeSuccess("Request Created"));

        assertThat(recipeService.requested()).containsExactly(A_RECIPE);
        assertThat(TestRepositories.readFromOrigin(origin, "requested-recipes/a_recipe@1.2.yml"))
                .hasValueSatisfying(yaml -> assertThat(yaml).contains("https://example.com/a_recipe"));
        verify(emailNotifier).send(
                same(settings.getRecipes()),
                eq("User: alice\nRecipe: a_recipe\nVersion: 1.2\nURL: https://example.com/a_recipe\nDescription: a library"),
                eq("SoftPack Recipe Request: a_recipe@1.2"),
                eq("alice"),
                eq(false));
    }

    @Test
    void duplicateAndIncompleteRequestsAreRejected() throws Exception {
        recipeService.request(A_RECIPE);
        var head = store.headCommit();

        assertThat(recipeService.request(A_RECIPE)).isEqualTo(new InvalidInputError("File already exists"));
        assertThat(recipeService.request(new RecipeRequest("b_recipe", "1.0", null, "u", "alice")))
                .isEqualTo(new InvalidInputError("Invalid Input"));
        assertThat(recipeService.request(new RecipeRequest("../escape", "1.0", "d", "u", "alice")))
                .isEqualTo(new InvalidInputError("Invalid Input"));
        assertThat(store.headCommit()).isEqualTo(head);
    }

    @Test
    void requestsAreListedByNameAndAnonymousRequestsSendNoMail() {
        var b = new RecipeRequest("b_recipe", "0.1", "second", "https://example.com/b", "");
        recipeService.request(b);
        recipeService.request(A_RECIPE);

        assertThat(recipeService.requested()).containsExactly(A_RECIPE, b);
        verify(emailNotifier, never()).send(any(), anyString(), anyString(), eq(""), anyBoolean());
    }

    @Test
    void fulfilReplacesRecipeAndDispatchesWaitingEnvironment() {
        recipeService.request(A_RECIPE);
        String name = createWaiting(PackageSpec.requestedRecipe("a_recipe", "1.2"));
        assertThat(environment(name).getState()).isEqualTo(EnvironmentState.WAITING);
        verifyNoInteractions(builderClient);
        when(catalogService.packages()).thenReturn(List.of(new CatalogPackage("a_recipe", List.of("1.2", "1.3"), "a library")));

        assertThat(recipeService.fulfil("a_recipe", "1.3", "a_recipe", "1.2"))
                .isEqualTo(new RecipeSuccess("Recipe Fulfilled"));

        List<PackageSpec> expected = List.of(PackageSpec.parse("zlib@1.3.1"), new PackageSpec("a_recipe", "1.3"));
        Environment env = environment(name);
        assertThat(env.getPackages()).isEqualTo(expected);
        assertThat(env.getState()).isEqualTo(EnvironmentState.QUEUED);
        verify(builderClient).dispatch("users/alice", "myenv", "1", "my env", expected);
        assertThat(recipeService.requested()).isEmpty();
    }

    @Test
    void environmentKeepsWaitingWhileOtherRecipesAreOutstanding() {
        recipeService.request(A_RECIPE);
        recipeService.request(new RecipeRequest("b_recipe", "2.0", "other", "https://example.com/b", "alice"));
        String name = createWaiting(PackageSpec.requestedRecipe("a_recipe", "1.2"), PackageSpec.requestedRecipe("b_recipe", "2.0"));
        when(catalogService.packages()).thenReturn(List.of(new CatalogPackage("a_recipe", List.of("1.2"), "a library")));

        assertThat(recipeService.fulfil("a_recipe", "1.2", "a_recipe", "1.2"))
                .isEqualTo(new RecipeSuccess("Recipe Fulfilled"));

        Environment env = environment(name);
        assertThat(env.getState()).isEqualTo(EnvironmentState.WAITING);
        assertThat(env.getPackages()).contains(new PackageSpec("a_recipe", "1.2"), PackageSpec.requestedRecipe("b_recipe", "2.0"));
        verifyNoInteractions(builderClient);
        assertThat(recipeService.requested()).extracting(RecipeRequest::name).containsExactly("b_recipe");
    }

    @Test
    void fulfilRequiresRequestAndCatalogVersion() {
        when(catalogService.packages()).thenReturn(List.of(new CatalogPackage("a_recipe", List.of("1.2"), "a library")));

        assertThat(recipeService.fulfil("a_recipe", "1.2", "a_recipe", "1.2"))
                .isEqualTo(new InvalidInputError("Unknown Recipe"));

        recipeService.request(A_RECIPE);
        assertThat(recipeService.fulfil("a_recipe", "9.9", "a_recipe", "1.2"))
                .isEqualTo(new InvalidInputError("Unknown Recipe"));
        assertThat(recipeService.fulfil("missing", "1.2", "a_recipe", "1.2"))
                .isEqualTo(new InvalidInputError("Unknown Recipe"));
        assertThat(recipeService.requested()).containsExactly(A_RECIPE);
    }

    @Test
    void removeIsRefusedWhileEnvironmentsRelyOnRequest() {
        recipeService.request(A_RECIPE);
        String name = createWaiting(PackageSpec.requestedRecipe("a_recipe", "1.2"));

        assertThat(recipeService.remove("a_recipe", "1.2")).isEqualTo(new InvalidInputError(RecipeService.IN_USE));

        assertThat(environmentService.delete(name, "users/alice")).isInstanceOf(DeleteEnvironmentSuccess.class);
        assertThat(recipeService.remove("a_recipe", "1.2")).isEqualTo(new RecipeSuccess("Request Removed"));
        assertThat(recipeService.remove("a_recipe", "1.2")).isEqualTo(new InvalidInputError("Unknown Recipe"));
        assertThat(recipeService.requested()).isEmpty();
    }

    @Test
    void hiddenEnvironmentsStillBlockRemoval() {
        recipeService.request(A_RECIPE);
        String name = createWaiting(PackageSpec.requestedRecipe("a_recipe", "1.2"));
        environmentService.setHidden(name, "users/alice", true);

        assertThat(recipeService.remove("a_recipe", "1.2")).isEqualTo(new InvalidInputError(RecipeService.IN_USE));
    }

    @Test
    void descriptionComesFromCatalog() {
        when(catalogService.descriptions()).thenReturn(Map.of("zlib", "compression library"));

        assertThat(recipeService.description("zlib")).contains("compression library");
        assertThat(recipeService.description("nope")).isEmpty();
        assertThat(recipeService.description("")).isEmpty();
    }
}

package club.ppmc.softpack.controller;

import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import club.ppmc.softpack.model.BuildStatus;
import club.ppmc.softpack.model.BuildStatusSummary;
import club.ppmc.softpack.model.CatalogPackage;
import club.ppmc.softpack.model.Environment;
import club.ppmc.softpack.model.EnvironmentInput;
import club.ppmc.softpack.model.EnvironmentResult;
import club.ppmc.softpack.model.EnvironmentState;
import club.ppmc.softpack.model.EnvironmentType;
import club.ppmc.softpack.model.PackageSpec;
import club.ppmc.softpack.model.RecipeRequest;
import club.ppmc.softpack.model.ResendResult;
import club.ppmc.softpack.service.BuilderClient;
import club.ppmc.softpack.service.EnvironmentService;
import club.ppmc.softpack.service.GroupService;
import club.ppmc.softpack.service.PackageCatalogService;
import club.ppmc.softpack.service.RecipeService;
import java.net.URI;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(EnvironmentController.class)
class EnvironmentControllerTest {

    private static final String CREATE_BODY =
            "{\"name\": \"myenv\", \"path\": \"users/alice\", \"description\": \"d\","
                    + " \"packages\": [\"zlib@1.3.1\", \"py-numpy\"], \"username\": \"alice\"}";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private EnvironmentService environmentService;

    @MockBean
    private PackageCatalogService catalogService;

    @MockBean
    private BuilderClient builderClient;

    @MockBean
    private GroupService groupService;

    @MockBean
    private RecipeService recipeService;

    @Test
    void listsEnvironmentsForUser() throws Exception {
        var env = Environment.builder()
                .name("myenv-1")
                .path("users/alice")
                .description("d")
                .packages(List.of(PackageSpec.of("zlib")))
                .state(EnvironmentState.READY)
                .type(EnvironmentType.SOFTPACK)
                .tags(List.of("a"))
                .build();
        when(environmentService.iter("alice")).thenReturn(List.of(env));

        mockMvc.perform(get("/api/environments").param("username", "alice"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].name").value("myenv-1"))
                .andExpect(jsonPath("$[0].state").value("ready"))
                .andExpect(jsonPath("$[0].packages[0].name").value("zlib"));
    }

    @Test
    void missingEnvironmentIs404() throws Exception {
        when(environmentService.get("users/alice", "nope-1")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/environment").param("path", "users/alice").param("name", "nope-1"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("No environment with this name found in this location."));
    }

    @Test
    void createParsesPackagesAndReturnsResult() throws Exception {
        var input = new EnvironmentInput(
                "myenv", "users/alice", "d", List.of(PackageSpec.parse("zlib@1.3.1"), PackageSpec.of("py-numpy")), "alice");
        when(environmentService.create(input)).thenReturn(new EnvironmentResult.CreateEnvironmentSuccess(
                "Successfully scheduled environment creation", "users/alice", "myenv-1", null));

        mockMvc.perform(post("/api/environments").contentType(MediaType.APPLICATION_JSON).content(CREATE_BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("myenv-1"))
                .andExpect(jsonPath("$.message").value("Successfully scheduled environment creation"));
    }

    @Test
    void createMapsConflictAndValidationFailures() throws Exception {
        when(environmentService.create(any())).thenReturn(
                new EnvironmentResult.EnvironmentAlreadyExistsError("This name is already used in this location", "users/alice", "myenv"));

        mockMvc.perform(post("/api/environments").contentType(MediaType.APPLICATION_JSON).content(CREATE_BODY))
                .andExpect(status().isConflict());

        mockMvc.perform(post("/api/environments")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": \"\", \"path\": \"users/alice\", \"description\": \"d\", \"packages\": []}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void blankPackageNameIsInvalidInput() throws Exception {
        mockMvc.perform(post("/api/environments")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": \"x\", \"path\": \"users/alice\", \"description\": \"d\", \"packages\": [\"@1.0\"]}"))
                .andExpect(status().isBadRequest());
        verifyNoInteractions(environmentService);
    }

    @Test
    void updateAndDeleteUseQueryParameters() throws Exception {
        when(environmentService.update(any(), eq("users/alice"), eq("myenv-1")))
                .thenReturn(new EnvironmentResult.UpdateEnvironmentSuccess("Successfully updated environment", null));
        when(environmentService.delete("myenv-1", "users/alice"))
                .thenReturn(new EnvironmentResult.EnvironmentNotFoundError("missing", "users/alice", "myenv-1"));

        mockMvc.perform(put("/api/environments")
                        .param("path", "users/alice")
                        .param("name", "myenv-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(CREATE_BODY))
                .andExpect(status().isOk());
        mockMvc.perform(delete("/api/environments").param("path", "users/alice").param("name", "myenv-1"))
                .andExpect(status().isNotFound());
    }

    @Test
    void tagsAndHiddenDelegateToService() throws Exception {
        when(environmentService.addTag("myenv-1", "users/alice", "gpu"))
                .thenReturn(new EnvironmentResult.AddTagSuccess("Tag successfully added"));
        when(environmentService.setHidden("myenv-1", "users/alice", true))
                .thenReturn(new EnvironmentResult.ConcurrentModificationError("too many changes to the repo"));

        mockMvc.perform(post("/api/environments/tags")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"path\": \"users/alice\", \"name\": \"myenv-1\", \"tag\": \"gpu\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Tag successfully added"));
        mockMvc.perform(post("/api/environments/hidden")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"path\": \"users/alice\", \"name\": \"myenv-1\", \"hidden\": true}"))
                .andExpect(status().isConflict());
    }

    @Test
    void uploadTakesEnvironmentPathFromQueryString() throws Exception {
        when(environmentService.uploadArtifacts(eq("users/alice/myenv-1"), anyList()))
                .thenReturn(new EnvironmentResult.WriteArtifactSuccess("Successfully written artifact(s)", "abc123"));

        mockMvc.perform(multipart(URI.create("/api/upload?users%2Falice%2Fmyenv-1"))
                        .file(new MockMultipartFile("file", "module", "application/octet-stream", "#%Module".getBytes()))
                        .file(new MockMultipartFile("file", "spack.lock", "application/json", "{}".getBytes())))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.commitOid").value("abc123"));

        verify(environmentService).uploadArtifacts(eq("users/alice/myenv-1"), anyList());
    }

    @Test
    void resendReports500WhenAnyDispatchFails() throws Exception {
        when(environmentService.resendPendingBuilds())
                .thenReturn(new ResendResult("Failed to trigger all resends", 2, 1));

        mockMvc.perform(post("/api/resend-pending-builds"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.successes").value(2))
                .andExpect(jsonPath("$.failures").value(1));
    }

    @Test
    void buildStatusSummarisesBuilderResponse() throws Exception {
        OffsetDateTime start = OffsetDateTime.parse("2024-05-01T10:00:10Z");
        List<BuildStatus> statuses = List.of(new BuildStatus("users/alice/myenv-1", null, start, null));
        when(builderClient.statuses()).thenReturn(new BuilderClient.StatusResponse(statuses, null));
        when(environmentService.buildStatus(statuses))
                .thenReturn(new BuildStatusSummary(null, Map.of("users/alice/myenv-1", start)));

        mockMvc.perform(get("/api/build-status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.statuses['users/alice/myenv-1']").exists());
    }

    @Test
    void buildStatusReportsBuilderFailure() throws Exception {
        when(builderClient.statuses()).thenReturn(new BuilderClient.StatusResponse(
                List.of(), new EnvironmentResult.BuilderError("Connection to builder failed: refused")));

        mockMvc.perform(get("/api/build-status"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.message").value("Connection to builder failed: refused"));
    }

    @Test
    void moduleUploadPassesPathsAndContents() throws Exception {
        byte[] module = "module-whatis \"Name: tool\"".getBytes();
        when(environmentService.createFromModule(module, "tools/tool", "groups/hgi/tool"))
                .thenReturn(new EnvironmentResult.CreateEnvironmentSuccess(
                        "Successfully created environment in artifacts repo", "groups/hgi", "tool", null));
        when(environmentService.updateFromModule(module, "tools/tool", "groups/hgi/tool"))
                .thenReturn(new EnvironmentResult.RepositoryUnavailableError("artifacts repository unavailable"));

        mockMvc.perform(multipart("/api/upload-module")
                        .file(new MockMultipartFile("file", "tool", "text/plain", module))
                        .param("module_path", "tools/tool")
                        .param("environment_path", "groups/hgi/tool"))
                .andExpect(status().isOk());
        mockMvc.perform(multipart("/api/update-module")
                        .file(new MockMultipartFile("file", "tool", "text/plain", module))
                        .param("module_path", "tools/tool")
                        .param("environment_path", "groups/hgi/tool"))
                .andExpect(status().isServiceUnavailable());
    }

    @Test
    void packageCollectionAndGroups() throws Exception {
        when(catalogService.packages()).thenReturn(List.of(new CatalogPackage("zlib", List.of("1.3.1"), "compression")));
        when(groupService.groups("alice")).thenReturn(List.of("hgi"));

        mockMvc.perform(get("/api/package-collection"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].versions[0]").value("1.3.1"));
        mockMvc.perform(get("/api/groups").param("username", "alice"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0]").value("hgi"));
    }

    @Test
    void recipeRequestsAreCreatedListedAndRemoved() throws Exception {
        var request = new RecipeRequest("a_recipe", "1.2", "a library", "https://example.com", "alice");
        when(recipeService.request(request)).thenReturn(new EnvironmentResult.RecipeSuccess("Request Created"));
        when(recipeService.requested()).thenReturn(List.of(request));
        when(recipeService.remove("a_recipe", "1.2")).thenReturn(new EnvironmentResult.InvalidInputError(
                "There are environments relying on this requested recipe; can not delete."));

        mockMvc.perform(post("/api/requested-recipes")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": \"a_recipe\", \"version\": \"1.2\", \"description\": \"a library\","
                                + " \"url\": \"https://example.com\", \"username\": \"alice\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Request Created"));
        mockMvc.perform(get("/api/requested-recipes"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].name").value("a_recipe"))
                .andExpect(jsonPath("$[0].url").value("https://example.com"));
        mockMvc.perform(delete("/api/requested-recipes").param("name", "a_recipe").param("version", "1.2"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void fulfilPassesBothRecipesToService() throws Exception {
        when(recipeService.fulfil("a_recipe", "1.3", "a_recipe", "1.2"))
                .thenReturn(new EnvironmentResult.RecipeSuccess("Recipe Fulfilled"));

        mockMvc.perform(post("/api/requested-recipes/fulfil")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": \"a_recipe\", \"version\": \"1.3\","
                                + " \"requestedName\": \"a_recipe\", \"requestedVersion\": \"1.2\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Recipe Fulfilled"));
        mockMvc.perform(post("/api/requested-recipes/fulfil")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": \"a_recipe\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void recipeDescriptionIsLookedUpInCatalog() throws Exception {
        when(recipeService.description("zlib")).thenReturn(Optional.of("compression library"));
        when(recipeService.description("nope")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/recipe-description").param("recipe", "zlib"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.description").value("compression library"));
        mockMvc.perform(get("/api/recipe-description").param("recipe", "nope"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Invalid Input"));
    }
}

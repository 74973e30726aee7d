/**
 * EnvironmentController.java
 *
 * 该控制器处理所有与环境相关的HTTP请求。
 * 它只负责请求映射：把请求交给 EnvironmentService 等服务，再把返回的结果变体翻译成 HTTP 状态码。
 * 构建服务通过 /api/upload?&lt;环境路径&gt; 上传构建结果。
 * 配方请求的创建、列出、完成和移除位于 /api/requested-recipes 下。
 */
package club.ppmc.softpack.controller;

import club.ppmc.softpack.model.BuildStatusSummary;
import club.ppmc.softpack.model.CatalogPackage;
import club.ppmc.softpack.model.Environment;
import club.ppmc.softpack.model.EnvironmentRequest;
import club.ppmc.softpack.model.EnvironmentResult;
import club.ppmc.softpack.model.FulfilRecipeRequest;
import club.ppmc.softpack.model.HiddenRequest;
import club.ppmc.softpack.model.RecipeRequest;
import club.ppmc.softpack.model.ResendResult;
import club.ppmc.softpack.model.TagRequest;
import club.ppmc.softpack.model.UploadedFile;
import club.ppmc.softpack.service.BuilderClient;
import club.ppmc.softpack.service.EnvironmentService;
import club.ppmc.softpack.service.GroupService;
import club.ppmc.softpack.service.PackageCatalogService;
import club.ppmc.softpack.service.RecipeService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import java.io.IOException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

@RestController
@RequestMapping("/api")
@Slf4j
public class EnvironmentController {

    private final EnvironmentService environmentService;
    private final PackageCatalogService catalogService;
    private final BuilderClient builderClient;
    private final GroupService groupService;
    private final RecipeService recipeService;

    public EnvironmentController(
            EnvironmentService environmentService,
            PackageCatalogService catalogService,
            BuilderClient builderClient,
            GroupService groupService,
            RecipeService recipeService) {
        this.environmentService = environmentService;
        this.catalogService = catalogService;
        this.builderClient = builderClient;
        this.groupService = groupService;
        this.recipeService = recipeService;
    }

    // --- 环境 ---

    /**
     * 列出环境。给出 username 时只列出该用户及其所属组的环境。
     */
    @GetMapping("/environments")
    public List<Environment> listEnvironments(@RequestParam(required = false) String username) {
        return environmentService.iter(username);
    }

    @GetMapping("/environment")
    public ResponseEntity<?> getEnvironment(@RequestParam String path, @RequestParam String name) {
        return environmentService.get(path, name)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body(Map.of("message", "No environment with this name found in this location.")));
    }

    @PostMapping("/environments")
    public ResponseEntity<EnvironmentResult> createEnvironment(@Valid @RequestBody EnvironmentRequest request) {
        try {
            return toResponse(environmentService.create(request.toInput()));
        } catch (IllegalArgumentException e) {
            return toResponse(new EnvironmentResult.InvalidInputError(e.getMessage()));
        }
    }

    @PutMapping("/environments")
    public ResponseEntity<EnvironmentResult> updateEnvironment(
            @RequestParam String path, @RequestParam String name, @Valid @RequestBody EnvironmentRequest request) {
        try {
            return toResponse(environmentService.update(request.toInput(), path, name));
        } catch (IllegalArgumentException e) {
            return toResponse(new EnvironmentResult.InvalidInputError(e.getMessage()));
        }
    }

    @DeleteMapping("/environments")
    public ResponseEntity<EnvironmentResult> deleteEnvironment(@RequestParam String path, @RequestParam String name) {
        return toResponse(environmentService.delete(name, path));
    }

    @PostMapping("/environments/tags")
    public ResponseEntity<EnvironmentResult> addTag(@Valid @RequestBody TagRequest request) {
        return toResponse(environmentService.addTag(request.name(), request.path(), request.tag()));
    }

    @PostMapping("/environments/hidden")
    public ResponseEntity<EnvironmentResult> setHidden(@Valid @RequestBody HiddenRequest request) {
        return toResponse(environmentService.setHidden(request.name(), request.path(), request.hidden()));
    }

    // --- 构建服务 ---

    /**
     * 接收构建服务上传的文件。环境路径是整个（URL 编码的）查询字符串，例如 /api/upload?users%2Falice%2Ffoo-1。
     */
    @PostMapping("/upload")
    public ResponseEntity<EnvironmentResult> uploadArtifacts(
            HttpServletRequest request, @RequestParam("file") List<MultipartFile> files) {
        String query = request.getQueryString();
        String environmentPath = query == null ? "" : URLDecoder.decode(query, StandardCharsets.UTF_8);
        try {
            var uploads = new ArrayList<UploadedFile>();
            for (MultipartFile file : files) {
                uploads.add(new UploadedFile(file.getOriginalFilename(), file.getBytes()));
            }
            return toResponse(environmentService.uploadArtifacts(environmentPath, uploads));
        } catch (IOException e) {
            log.error("读取上传到 {} 的文件失败", environmentPath, e);
            return toResponse(new EnvironmentResult.InvalidInputError("读取上传文件失败: " + e.getMessage()));
        }
    }

    @PostMapping("/resend-pending-builds")
    public ResponseEntity<ResendResult> resendPendingBuilds() {
        ResendResult result = environmentService.resendPendingBuilds();
        return result.allSucceeded()
                ? ResponseEntity.ok(result)
                : ResponseEntity.internalServerError().body(result);
    }

    @GetMapping("/build-status")
    public ResponseEntity<?> buildStatus() {
        BuilderClient.StatusResponse response = builderClient.statuses();
        if (!response.succeeded()) {
            return ResponseEntity.internalServerError().body(response.error());
        }
        BuildStatusSummary summary = environmentService.buildStatus(response.statuses());
        return ResponseEntity.ok(summary);
    }

    // --- 模块 ---

    @PostMapping("/upload-module")
    public ResponseEntity<EnvironmentResult> uploadModule(
            @RequestParam("module_path") String modulePath,
            @RequestParam("environment_path") String environmentPath,
            @RequestParam("file") MultipartFile file) {
        try {
            return toResponse(environmentService.createFromModule(file.getBytes(), modulePath, environmentPath));
        } catch (IOException e) {
            log.error("读取模块文件失败", e);
            return toResponse(new EnvironmentResult.InvalidInputError("读取模块文件失败: " + e.getMessage()));
        }
    }

    @PostMapping("/update-module")
    public ResponseEntity<EnvironmentResult> updateModule(
            @RequestParam("module_path") String modulePath,
            @RequestParam("environment_path") String environmentPath,
            @RequestParam("file") MultipartFile file) {
        try {
            return toResponse(environmentService.updateFromModule(file.getBytes(), modulePath, environmentPath));
        } catch (IOException e) {
            log.error("读取模块文件失败", e);
            return toResponse(new EnvironmentResult.InvalidInputError("读取模块文件失败: " + e.getMessage()));
        }
    }

    // --- 配方请求 ---

    @PostMapping("/requested-recipes")
    public ResponseEntity<EnvironmentResult> requestRecipe(@RequestBody RecipeRequest request) {
        return toResponse(recipeService.request(request));
    }

    @GetMapping("/requested-recipes")
    public List<RecipeRequest> requestedRecipes() {
        return recipeService.requested();
    }

    @PostMapping("/requested-recipes/fulfil")
    public ResponseEntity<EnvironmentResult> fulfilRequestedRecipe(@Valid @RequestBody FulfilRecipeRequest request) {
        return toResponse(recipeService.fulfil(
                request.name(), request.version(), request.requestedName(), request.requestedVersion()));
    }

    @DeleteMapping("/requested-recipes")
    public ResponseEntity<EnvironmentResult> removeRequestedRecipe(@RequestParam String name, @RequestParam String version) {
        return toResponse(recipeService.remove(name, version));
    }

    @GetMapping("/recipe-description")
    public ResponseEntity<Map<String, String>> recipeDescription(@RequestParam String recipe) {
        return recipeService.description(recipe)
                .map(description -> ResponseEntity.ok(Map.of("description", description)))
                .orElseGet(() -> ResponseEntity.badRequest().body(Map.of("message", "Invalid Input")));
    }

    // --- 目录与用户组 ---

    @GetMapping("/package-collection")
    public List<CatalogPackage> packageCollection() {
        return catalogService.packages();
    }

    @GetMapping("/groups")
    public List<String> groups(@RequestParam String username) {
        return groupService.groups(username);
    }

    private static ResponseEntity<EnvironmentResult> toResponse(EnvironmentResult result) {
        HttpStatus status;
        if (result instanceof EnvironmentResult.Success) {
            status = HttpStatus.OK;
        } else if (result instanceof EnvironmentResult.InvalidInputError) {
            status = HttpStatus.BAD_REQUEST;
        } else if (result instanceof EnvironmentResult.EnvironmentNotFoundError) {
            status = HttpStatus.NOT_FOUND;
        } else if (result instanceof EnvironmentResult.EnvironmentAlreadyExistsError
                || result instanceof EnvironmentResult.ConcurrentModificationError) {
            status = HttpStatus.CONFLICT;
        } else if (result instanceof EnvironmentResult.BuilderError) {
            status = HttpStatus.BAD_GATEWAY;
        } else {
            status = HttpStatus.SERVICE_UNAVAILABLE;
        }
        return ResponseEntity.status(status).body(result);
    }
}

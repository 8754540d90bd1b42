package com.cgi.dbconnector.api;

import com.cgi.dbconnector.api.dto.ApiResponse;
import com.cgi.dbconnector.api.dto.DownloadRequest;
import com.cgi.dbconnector.api.dto.DriverHandleResponse;
import com.cgi.dbconnector.api.dto.DriverLoadRequest;
import com.cgi.dbconnector.core.catalog.DriverDescriptor;
import com.cgi.dbconnector.core.driver.DriverHandle;
import com.cgi.dbconnector.core.driver.RegistryKey;
import com.cgi.dbconnector.service.DriverService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Controller for downloading, locating and loading JDBC drivers.
 */
@RestController
@RequestMapping("/api/drivers")
@Tag(name = "JDBC Drivers", description = "API for installing and loading third-party JDBC drivers")
public class DriverController {
    private static final Logger logger = LoggerFactory.getLogger(DriverController.class);

    private final DriverService driverService;

    public DriverController(DriverService driverService) {
        this.driverService = driverService;
    }

    @Operation(summary = "List the drivers available for download")
    @GetMapping("/catalog")
    public ResponseEntity<ApiResponse<Collection<DriverDescriptor>>> catalog() {
        return ResponseEntity.ok(ApiResponse.success(driverService.catalog()));
    }

    @Operation(summary = "Download and unzip the drivers for a DBMS")
    @PostMapping("/downloads")
    public ResponseEntity<ApiResponse<Map<String, String>>> download(@RequestBody DownloadRequest request) {
        logger.info("Download requested for {} into {}", request.getDbms(), request.getPathToDriver());
        Path folder = driverService.downloadDrivers(request.getDbms(), request.getPathToDriver(),
                request.toOptions());
        return ResponseEntity.ok(ApiResponse.success(Map.of(
                "dbms", request.getDbms(),
                "pathToDriver", folder.toString())));
    }

    @Operation(summary = "Find installed jars by file name pattern")
    @GetMapping("/jars")
    public ResponseEntity<ApiResponse<List<String>>> findJars(
            @RequestParam String pattern,
            @RequestParam(required = false) String pathToDriver) {
        List<String> jars = driverService.findJars(pattern, pathToDriver).stream()
                .map(Path::toString)
                .toList();
        return ResponseEntity.ok(ApiResponse.success(jars));
    }

    @Operation(summary = "Load a driver, from the catalog or from an explicit class path")
    @PostMapping("/load")
    public ResponseEntity<ApiResponse<DriverHandleResponse>> load(@RequestBody DriverLoadRequest request) {
        DriverHandle handle;
        if (request.isExplicitClass()) {
            logger.info("Loading driver class {} from {}", request.getDriverClassName(), request.getClassPath());
            handle = driverService.loadDriver(request.getDriverClassName(), request.getClassPath());
        } else {
            if (request.getDbms() == null || request.getDbms().isBlank()) {
                throw new IllegalArgumentException("Either dbms or driverClassName must be specified");
            }
            logger.info("Loading driver for {}", request.getDbms());
            handle = driverService.getDriver(request.getDbms(), request.getPathToDriver(), request.isDownload());
        }
        return ResponseEntity.ok(ApiResponse.success(DriverHandleResponse.from(handle)));
    }

    @Operation(summary = "List the loaded drivers")
    @GetMapping("/loaded")
    public ResponseEntity<ApiResponse<List<RegistryKey>>> loaded() {
        return ResponseEntity.ok(ApiResponse.success(new ArrayList<>(driverService.loadedDrivers())));
    }
}

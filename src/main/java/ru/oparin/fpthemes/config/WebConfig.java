package ru.oparin.fpthemes.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.server.RouterFunction;
import org.springframework.web.reactive.function.server.RouterFunctions;
import org.springframework.web.reactive.function.server.ServerResponse;
import ru.oparin.fpthemes.service.PreviewStorageService;

import java.nio.file.Path;

import static org.springframework.web.reactive.function.server.RequestPredicates.GET;
import static org.springframework.web.reactive.function.server.ServerResponse.ok;

/**
 * Раздача сохраненных превью тем по адресу /files/previews/{имя файла}.
 */
@Configuration
@RequiredArgsConstructor
public class WebConfig {

    private final PreviewStorageService previewStorageService;

    @Bean
    public RouterFunction<ServerResponse> previewResourceRouter() {
        return RouterFunctions
                .route(GET("/files/previews/{name}"), request -> {
                    Path filePath = previewStorageService.resolve(request.pathVariable("name"));
                    if (filePath == null) {
                        return ServerResponse.notFound().build();
                    }

                    Resource resource = new FileSystemResource(filePath);
                    if (resource.exists() && resource.isReadable()) {
                        return ok()
                                .contentType(MediaType.IMAGE_JPEG)
                                .bodyValue(resource);
                    }
                    return ServerResponse.notFound().build();
                });
    }
}

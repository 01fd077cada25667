package com.example.songshare.controller;

import com.example.songshare.model.RequestContext;
import com.example.songshare.model.SongDownload;
import com.example.songshare.model.SongView;
import com.example.songshare.model.UploadResult;
import com.example.songshare.service.ShareService;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.InputStreamResource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.InvalidMediaTypeException;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.nio.charset.StandardCharsets;
import java.util.List;

@RestController
@RequestMapping("/api/songs")
@RequiredArgsConstructor
public class SongController {

    private static final Logger log = LoggerFactory.getLogger(SongController.class);
    private static final String FORWARDED_FOR = "X-Forwarded-For";

    private final ShareService shareService;

    @PostMapping(path = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<UploadResult> upload(
        @RequestPart(value = "file", required = false) MultipartFile file,
        @RequestParam(required = false) String title,
        @RequestParam(required = false) String artist,
        @RequestParam(required = false) String description
    ) {
        UploadResult result = shareService.upload(title, artist, description, file);
        return ResponseEntity.status(HttpStatus.CREATED).body(result);
    }

    @GetMapping
    public List<SongView> listRecent(@RequestParam(defaultValue = "20") int limit) {
        return shareService.listRecent(limit);
    }

    @GetMapping("/{slug}")
    public SongView getSong(@PathVariable String slug, HttpServletRequest request) {
        return shareService.describe(slug, toContext(request));
    }

    @GetMapping("/{slug}/download")
    public ResponseEntity<InputStreamResource> download(@PathVariable String slug, HttpServletRequest request) {
        SongDownload download = shareService.download(slug, toContext(request));

        MediaType mediaType = MediaType.APPLICATION_OCTET_STREAM;
        try {
            mediaType = MediaType.parseMediaType(download.getMimeType());
        } catch (InvalidMediaTypeException ex) {
            log.debug("Serving {} as octet-stream, stored type '{}' is invalid", slug, download.getMimeType());
        }
        ContentDisposition disposition = ContentDisposition.attachment()
            .filename(download.getFilename(), StandardCharsets.UTF_8)
            .build();

        return ResponseEntity.ok()
            .header(HttpHeaders.CONTENT_DISPOSITION, disposition.toString())
            .contentType(mediaType)
            .contentLength(download.getSizeBytes())
            .body(new InputStreamResource(download.getStream()));
    }

    private RequestContext toContext(HttpServletRequest request) {
        String forwarded = request.getHeader(FORWARDED_FOR);
        String ip = StringUtils.hasText(forwarded)
            ? forwarded.split(",", 2)[0].trim()
            : request.getRemoteAddr();
        return RequestContext.builder()
            .ipAddress(ip)
            .userAgent(request.getHeader(HttpHeaders.USER_AGENT))
            .referer(request.getHeader(HttpHeaders.REFERER))
            .build();
    }
}

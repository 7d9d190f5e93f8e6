package com.example.rentroll.interfaces.api;

import com.example.rentroll.application.exception.ApplicationException;
import com.example.rentroll.application.exception.DownloadValidationException;
import com.example.rentroll.application.service.RentRollProcessingService;
import com.example.rentroll.domain.exception.DomainException;
import com.example.rentroll.domain.model.ProcessedWorkbook;
import com.example.rentroll.domain.model.ProcessingResult;
import com.example.rentroll.domain.model.ProcessingStage;
import com.example.rentroll.infrastructure.exception.InfrastructureException;
import jakarta.servlet.http.HttpSession;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Controller;
import org.springframework.ui.Model;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseBody;
import org.springframework.web.multipart.MultipartFile;

/**
 * Interfaces-layer MVC controller that handles rent roll uploads and processed workbook downloads.
 */
@Controller
public class RentRollUploadController {

    private static final String SESSION_WORKBOOK_KEY = "LATEST_PROCESSED_WORKBOOK";
    private static final MediaType XLSX_MEDIA_TYPE = MediaType.parseMediaType(RentRollProcessingService.XLSX_CONTENT_TYPE);

    private final RentRollProcessingService processingService;

    /**
     * @param processingService service running detection, extraction and write-back
     */
    public RentRollUploadController(RentRollProcessingService processingService) {
        this.processingService = processingService;
    }

    /**
     * Renders the upload page and pre-populates it with any cached result from the session.
     *
     * @param model   model used to expose attributes to the Thymeleaf view
     * @param session HTTP session storing the last processed workbook
     * @return upload view name
     */
    @GetMapping("/")
    public String showUploadForm(Model model, HttpSession session) {
        ProcessedWorkbook cached = (ProcessedWorkbook) session.getAttribute(SESSION_WORKBOOK_KEY);
        model.addAttribute("result", cached != null ? cached.result() : null);
        model.addAttribute("error", null);
        model.addAttribute("stages", ProcessingStage.values());
        return "upload";
    }

    /**
     * Handles form submissions that start processing.
     *
     * @param file    uploaded workbook
     * @param model   model used for view rendering
     * @param session HTTP session for caching the processed workbook
     * @return upload view name populated with success or error data
     */
    @PostMapping("/extract")
    public String handleUpload(@RequestParam("file") MultipartFile file, Model model, HttpSession session) {
        model.addAttribute("stages", ProcessingStage.values());
        try {
            ProcessedWorkbook processed = processingService.process(file);
            session.setAttribute(SESSION_WORKBOOK_KEY, processed);
            model.addAttribute("result", processed.result());
            model.addAttribute("error", null);
        } catch (DomainException | ApplicationException ex) {
            model.addAttribute("result", null);
            model.addAttribute("error", ex.getMessage());
        } catch (InfrastructureException ex) {
            model.addAttribute("result", null);
            model.addAttribute("error", "We couldn't read that workbook. Please try another file.");
        }
        return "upload";
    }

    /**
     * Streams the last processed workbook from the session.
     *
     * @param session HTTP session storing the processed workbook
     * @return workbook bytes as an attachment
     * @throws DownloadValidationException when nothing has been processed yet
     */
    @GetMapping("/download")
    public ResponseEntity<byte[]> download(HttpSession session) {
        ProcessedWorkbook cached = (ProcessedWorkbook) session.getAttribute(SESSION_WORKBOOK_KEY);
        if (cached == null) {
            throw new DownloadValidationException("No processed workbook available for download.");
        }
        return attachment(cached);
    }

    /**
     * REST endpoint that mirrors the HTML upload form but returns the JSON summary.
     *
     * @param file uploaded workbook
     * @return processing summary
     */
    @PostMapping(value = "/api/extract", produces = MediaType.APPLICATION_JSON_VALUE)
    @ResponseBody
    public ResponseEntity<ProcessingResult> handleUploadApi(@RequestParam("file") MultipartFile file) {
        return ResponseEntity.ok(processingService.process(file).result());
    }

    /**
     * REST endpoint returning the processed workbook directly.
     *
     * @param file uploaded workbook
     * @return processed workbook as an attachment
     */
    @PostMapping("/api/process")
    public ResponseEntity<byte[]> handleProcessApi(@RequestParam("file") MultipartFile file) {
        return attachment(processingService.process(file));
    }

    private ResponseEntity<byte[]> attachment(ProcessedWorkbook workbook) {
        ContentDisposition disposition = ContentDisposition.attachment()
                .filename(workbook.outputFileName())
                .build();
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, disposition.toString())
                .contentType(XLSX_MEDIA_TYPE)
                .body(workbook.content());
    }
}

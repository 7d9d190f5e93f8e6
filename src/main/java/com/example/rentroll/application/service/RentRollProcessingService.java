package com.example.rentroll.application.service;

import com.example.rentroll.domain.exception.StructureDetectionException;
import com.example.rentroll.domain.exception.UnsupportedWorkbookFormatException;
import com.example.rentroll.domain.exception.WorkbookFileRequiredException;
import com.example.rentroll.domain.exception.WorkbookNotFoundException;
import com.example.rentroll.domain.exception.WorkbookPathRequiredException;
import com.example.rentroll.domain.model.ProcessedWorkbook;
import com.example.rentroll.domain.model.ProcessingListener;
import com.example.rentroll.domain.model.ProcessingResult;
import com.example.rentroll.domain.model.ProcessingStage;
import com.example.rentroll.domain.model.RentRollExtraction;
import com.example.rentroll.domain.model.StructureDetection;
import com.example.rentroll.infrastructure.excel.PoiColumnFormatter;
import com.example.rentroll.infrastructure.excel.PoiSheetGrid;
import com.example.rentroll.infrastructure.exception.WorkbookProcessingException;
import org.apache.poi.UnsupportedFileFormatException;
import org.apache.poi.ooxml.POIXMLException;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Application-layer service that orchestrates rent roll processing.
 * It validates inputs, runs detection, extraction and write-back over the active sheet,
 * and returns the processed workbook as a new in-memory file.
 */
@Service
public class RentRollProcessingService {

    public static final String XLSX_CONTENT_TYPE = "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet";
    static final String OUTPUT_PREFIX = "processed_";

    private static final Logger log = LoggerFactory.getLogger(RentRollProcessingService.class);
    private static final String DEFAULT_FILE_NAME = "uploaded.xlsx";

    private final StructureDetector structureDetector;
    private final RentRollExtractor rentRollExtractor;
    private final ResultWriter resultWriter;
    private final PoiColumnFormatter columnFormatter;

    /**
     * Creates the service with the pipeline stages and the formatting helper.
     *
     * @param structureDetector infers the column layout
     * @param rentRollExtractor aggregates charges per unit
     * @param resultWriter      appends the aggregated columns
     * @param columnFormatter   sizes and highlights the appended columns
     */
    public RentRollProcessingService(StructureDetector structureDetector,
                                     RentRollExtractor rentRollExtractor,
                                     ResultWriter resultWriter,
                                     PoiColumnFormatter columnFormatter) {
        this.structureDetector = structureDetector;
        this.rentRollExtractor = rentRollExtractor;
        this.resultWriter = resultWriter;
        this.columnFormatter = columnFormatter;
    }

    /**
     * Processes an uploaded workbook without progress reporting.
     *
     * @param file uploaded .xlsx file
     * @return processed workbook and run summary
     */
    public ProcessedWorkbook process(MultipartFile file) {
        return process(file, ProcessingListener.NONE);
    }

    /**
     * Processes an uploaded workbook and reports each stage to the listener.
     *
     * @param file     uploaded .xlsx file
     * @param listener progress callbacks, may be {@code null}
     * @return processed workbook and run summary
     * @throws WorkbookFileRequiredException       when the file is null or empty
     * @throws UnsupportedWorkbookFormatException  when the MIME type/name does not look like .xlsx
     * @throws StructureDetectionException         when the unit or code column cannot be found
     * @throws WorkbookProcessingException         when POI cannot read or write the bytes
     */
    public ProcessedWorkbook process(MultipartFile file, ProcessingListener listener) {
        if (file == null || file.isEmpty()) {
            throw new WorkbookFileRequiredException();
        }
        if (!looksLikeWorkbook(file)) {
            throw new UnsupportedWorkbookFormatException(file.getOriginalFilename());
        }
        try {
            return processInternal(file.getBytes(), resolveFileName(file), listenerOrNone(listener));
        } catch (IOException e) {
            throw new WorkbookProcessingException("Unable to process the uploaded workbook.", e);
        }
    }

    /**
     * Reads a workbook from the filesystem and processes it.
     *
     * @param workbookPath path pointing to an .xlsx file on disk
     * @return processed workbook and run summary
     */
    public ProcessedWorkbook process(Path workbookPath) {
        return process(workbookPath, ProcessingListener.NONE);
    }

    /**
     * Reads a workbook from the filesystem and processes it, reporting each stage.
     *
     * @param workbookPath path pointing to an .xlsx file on disk
     * @param listener     progress callbacks, may be {@code null}
     * @return processed workbook and run summary
     * @throws WorkbookPathRequiredException when {@code workbookPath} is null
     * @throws WorkbookNotFoundException     when the path does not exist
     * @throws WorkbookProcessingException   when the file cannot be read
     */
    public ProcessedWorkbook process(Path workbookPath, ProcessingListener listener) {
        if (workbookPath == null) {
            throw new WorkbookPathRequiredException();
        }
        if (!Files.exists(workbookPath)) {
            throw new WorkbookNotFoundException(workbookPath.toAbsolutePath().toString());
        }
        try {
            byte[] bytes = Files.readAllBytes(workbookPath);
            String fileName = workbookPath.getFileName() != null ? workbookPath.getFileName().toString() : DEFAULT_FILE_NAME;
            return processInternal(bytes, fileName, listenerOrNone(listener));
        } catch (IOException e) {
            throw new WorkbookProcessingException("Unable to process the workbook at " + workbookPath, e);
        }
    }

    /**
     * Shared pipeline: detect, extract, append, adjust, then serialize into a fresh buffer.
     *
     * @param bytes    workbook bytes already loaded into memory
     * @param fileName logical name used for display and for the output name
     * @param listener progress callbacks
     * @return processed workbook
     * @throws IOException when the workbook cannot be serialized
     */
    private ProcessedWorkbook processInternal(byte[] bytes, String fileName, ProcessingListener listener) throws IOException {
        try (XSSFWorkbook workbook = openWorkbook(bytes, fileName);
             ByteArrayOutputStream output = new ByteArrayOutputStream()) {
            Sheet sheet = workbook.getSheetAt(workbook.getActiveSheetIndex());
            PoiSheetGrid grid = new PoiSheetGrid(sheet);
            List<ProcessingStage> completed = new ArrayList<>();

            listener.onStage(ProcessingStage.DETECTING_STRUCTURE);
            StructureDetection detection = structureDetector.detect(grid);
            completed.add(ProcessingStage.DETECTING_STRUCTURE);

            listener.onStage(ProcessingStage.EXTRACTING_CHARGES);
            RentRollExtraction extraction = rentRollExtractor.extract(grid, detection.columnMap());
            completed.add(ProcessingStage.EXTRACTING_CHARGES);

            listener.onStage(ProcessingStage.APPENDING_DATA);
            List<Integer> appended = resultWriter.write(grid, detection.columnMap(), extraction);
            completed.add(ProcessingStage.APPENDING_DATA);

            listener.onStage(ProcessingStage.ADJUSTING_COLUMNS);
            columnFormatter.autoSize(sheet, appended);
            columnFormatter.highlight(sheet, appended);
            completed.add(ProcessingStage.ADJUSTING_COLUMNS);

            workbook.write(output);
            ProcessingResult result = new ProcessingResult(
                    fileName,
                    OUTPUT_PREFIX + fileName,
                    detection.layout(),
                    detection.columnMap(),
                    extraction.units(),
                    extraction.chargeCodes(),
                    List.copyOf(appended),
                    detection.warnings(),
                    List.copyOf(completed)
            );
            log.info("Processed {}: {} units, {} charge codes, {} columns appended",
                    fileName, extraction.units().size(), extraction.chargeCodes().size(), appended.size());
            listener.onCompleted(result);
            return new ProcessedWorkbook(result, output.toByteArray());
        }
    }

    private XSSFWorkbook openWorkbook(byte[] bytes, String fileName) throws IOException {
        try {
            return new XSSFWorkbook(new ByteArrayInputStream(bytes));
        } catch (UnsupportedFileFormatException | POIXMLException ex) {
            throw new WorkbookProcessingException("Unable to read " + fileName + " as an .xlsx workbook.", ex);
        }
    }

    private ProcessingListener listenerOrNone(ProcessingListener listener) {
        return listener == null ? ProcessingListener.NONE : listener;
    }

    /**
     * Heuristic check to ensure the upload is an .xlsx workbook.
     *
     * @param file uploaded file
     * @return {@code true} when the MIME type or extension matches
     */
    private boolean looksLikeWorkbook(MultipartFile file) {
        String contentType = file.getContentType();
        if (contentType != null && contentType.equalsIgnoreCase(XLSX_CONTENT_TYPE)) {
            return true;
        }
        String fileName = file.getOriginalFilename();
        return fileName != null && fileName.toLowerCase(Locale.ROOT).endsWith(".xlsx");
    }

    /**
     * Determines a safe file name that can be shown to the user and used for the output name.
     *
     * @param file uploaded file
     * @return original filename or a default placeholder
     */
    private String resolveFileName(MultipartFile file) {
        String fileName = file.getOriginalFilename();
        if (fileName == null || fileName.isBlank()) {
            return DEFAULT_FILE_NAME;
        }
        return fileName;
    }
}

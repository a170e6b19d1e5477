package ir.ipaam.receiptservice.api.controller;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ibm.icu.text.CharsetDetector;
import com.ibm.icu.text.CharsetMatch;
import io.swagger.v3.oas.annotations.Operation;
import ir.ipaam.receiptservice.api.dto.BatchReceiptRequest;
import ir.ipaam.receiptservice.api.dto.ReceiptRequest;
import ir.ipaam.receiptservice.api.mapper.DonorRecordMapper;
import ir.ipaam.receiptservice.domain.command.GenerateReceiptBatchCommand;
import ir.ipaam.receiptservice.domain.command.GenerateReceiptCommand;
import ir.ipaam.receiptservice.domain.dto.BatchSummary;
import ir.ipaam.receiptservice.domain.dto.ReceiptGenerationResult;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.axonframework.commandhandling.gateway.CommandGateway;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/receipts")
@RequiredArgsConstructor
public class ReceiptController {

    private static final TypeReference<Map<String, Object>> DONOR_TYPE = new TypeReference<>() {
    };

    private final CommandGateway commandGateway;
    private final ObjectMapper objectMapper;

    @PostMapping(produces = MediaType.APPLICATION_PDF_VALUE)
    @Operation(summary = "Generate one receipt from a donor record and a template")
    public ResponseEntity<byte[]> generate(@Valid @RequestBody ReceiptRequest request) throws IOException {
        ReceiptGenerationResult result = commandGateway.sendAndWait(
                new GenerateReceiptCommand(DonorRecordMapper.toDonor(request.getDonor()), request.getTemplate())
        );
        return buildPdfResponse(result);
    }

    @PostMapping(value = "/batch", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Generate receipts for every donor; failures are counted, not thrown")
    public BatchSummary generateBatch(@Valid @RequestBody BatchReceiptRequest request) {
        return commandGateway.sendAndWait(
                new GenerateReceiptBatchCommand(DonorRecordMapper.toDonors(request.getDonors()), request.getTemplate())
        );
    }

    @PostMapping(
            value = "/upload",
            consumes = MediaType.MULTIPART_FORM_DATA_VALUE,
            produces = MediaType.APPLICATION_PDF_VALUE
    )
    @Operation(summary = "Generate one receipt from an uploaded template file and a donor JSON part")
    public ResponseEntity<byte[]> generateFromUpload(
            @RequestPart(value = "template", required = false) MultipartFile templateFile,
            @RequestPart("donor") String donorJson) throws IOException {
        String template = templateFile == null ? null : readTextContent(templateFile);
        Map<String, Object> donor = objectMapper.readValue(donorJson, DONOR_TYPE);
        ReceiptGenerationResult result = commandGateway.sendAndWait(
                new GenerateReceiptCommand(DonorRecordMapper.toDonor(donor), template)
        );
        return buildPdfResponse(result);
    }

    private ResponseEntity<byte[]> buildPdfResponse(ReceiptGenerationResult result) throws IOException {
        ContentDisposition contentDisposition = ContentDisposition.attachment()
                .filename(result.fileName(), StandardCharsets.UTF_8)
                .build();
        HttpHeaders headers = new HttpHeaders();
        headers.setContentDisposition(contentDisposition);
        headers.setContentType(MediaType.APPLICATION_PDF);
        headers.add("X-Receipt-Tier", result.tier().name());
        return new ResponseEntity<>(Files.readAllBytes(result.path()), headers, HttpStatus.OK);
    }

    private String readTextContent(MultipartFile file) throws IOException {
        byte[] bytes = file.getBytes();
        if (bytes.length == 0) {
            return "";
        }

        CharsetDetector detector = new CharsetDetector();
        detector.setText(bytes);
        CharsetMatch match = detector.detect();

        Charset charset = StandardCharsets.UTF_8;
        if (match != null && match.getName() != null) {
            try {
                charset = Charset.forName(match.getName());
            } catch (IllegalArgumentException e) {
                log.debug("Detected charset {} is not supported, reading as UTF-8", match.getName());
            }
        }

        String text = new String(bytes, charset);
        return !text.isEmpty() && text.charAt(0) == '\uFEFF' ? text.substring(1) : text;
    }
}

package ir.ipaam.receiptservice.api.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import ir.ipaam.receiptservice.application.service.receipt.strategy.StrategyTier;
import ir.ipaam.receiptservice.domain.command.GenerateReceiptBatchCommand;
import ir.ipaam.receiptservice.domain.command.GenerateReceiptCommand;
import ir.ipaam.receiptservice.domain.dto.BatchSummary;
import ir.ipaam.receiptservice.domain.dto.ReceiptGenerationResult;
import ir.ipaam.receiptservice.domain.dto.ReceiptOutcome;
import ir.ipaam.receiptservice.domain.exception.TotalFailureException;
import org.axonframework.commandhandling.gateway.CommandGateway;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class ReceiptControllerTest {

    @TempDir
    Path tempDir;

    private final CommandGateway commandGateway = mock(CommandGateway.class);
    private MockMvc mockMvc;
    private Path receipt;

    @BeforeEach
    void setUp() throws Exception {
        mockMvc = MockMvcBuilders
                .standaloneSetup(new ReceiptController(commandGateway, new ObjectMapper()))
                .setControllerAdvice(new ReceiptExceptionHandler())
                .build();
        receipt = Files.write(tempDir.resolve("receipt_Jane_Doe_20240305_101530.pdf"),
                "%PDF-1.7 fake".getBytes(StandardCharsets.US_ASCII));
    }

    @Test
    void generateShouldReturnPdfAttachment() throws Exception {
        when(commandGateway.<ReceiptGenerationResult>sendAndWait(any()))
                .thenReturn(new ReceiptGenerationResult(receipt, StrategyTier.PRIMARY, true));

        mockMvc.perform(post("/receipts")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"donor": {"First Name": "Jane", "Last Name": "Doe", "Donation Amount": 250},
                                 "template": "Dear {First Name},"}
                                """))
                .andExpect(status().isOk())
                .andExpect(content().contentType(MediaType.APPLICATION_PDF))
                .andExpect(header().string("Content-Disposition",
                        containsString("receipt_Jane_Doe_20240305_101530.pdf")))
                .andExpect(header().string("X-Receipt-Tier", "PRIMARY"))
                .andExpect(content().bytes(Files.readAllBytes(receipt)));

        ArgumentCaptor<Object> command = ArgumentCaptor.forClass(Object.class);
        verify(commandGateway).sendAndWait(command.capture());
        GenerateReceiptCommand sent = (GenerateReceiptCommand) command.getValue();
        assertThat(sent.donor().firstName()).isEqualTo("Jane");
        assertThat(sent.donor().get("Donation Amount")).contains("250");
        assertThat(sent.template()).isEqualTo("Dear {First Name},");
    }

    @Test
    void generateShouldForwardBlankTemplateForDefaultLetter() throws Exception {
        when(commandGateway.<ReceiptGenerationResult>sendAndWait(any()))
                .thenReturn(new ReceiptGenerationResult(receipt, StrategyTier.PRIMARY, true));

        mockMvc.perform(post("/receipts")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"donor\": {\"First Name\": \"Jane\"}, \"template\": \"  \"}"))
                .andExpect(status().isOk());

        ArgumentCaptor<Object> command = ArgumentCaptor.forClass(Object.class);
        verify(commandGateway).sendAndWait(command.capture());
        assertThat(((GenerateReceiptCommand) command.getValue()).template()).isBlank();
    }

    @Test
    void generateShouldRejectMissingDonor() throws Exception {
        mockMvc.perform(post("/receipts")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"template\": \"Hi\"}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(commandGateway);
    }

    @Test
    void generateShouldTurnTotalFailureIntoServerError() throws Exception {
        when(commandGateway.sendAndWait(any()))
                .thenThrow(new TotalFailureException("Jane Doe", List.of(new IllegalStateException("boom"))));

        mockMvc.perform(post("/receipts")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"donor\": {\"First Name\": \"Jane\", \"Last Name\": \"Doe\"}, \"template\": \"Hi\"}"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("RECEIPT_GENERATION_FAILED"))
                .andExpect(jsonPath("$.message").value(containsString("Jane Doe")));
    }

    @Test
    void generateBatchShouldReturnSummary() throws Exception {
        BatchSummary summary = BatchSummary.of(List.of(
                new ReceiptOutcome("Jane Doe", true, "receipt_Jane_Doe.pdf", StrategyTier.PRIMARY, null),
                ReceiptOutcome.failed("John Roe", "All rendering strategies failed")));
        when(commandGateway.<BatchSummary>sendAndWait(any())).thenReturn(summary);

        mockMvc.perform(post("/receipts/batch")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"donors": [{"First Name": "Jane"}, {"First Name": "John"}],
                                 "template": "Dear {First Name},"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.generated").value(1))
                .andExpect(jsonPath("$.failed").value(1))
                .andExpect(jsonPath("$.outcomes[1].donorName").value("John Roe"));

        ArgumentCaptor<Object> command = ArgumentCaptor.forClass(Object.class);
        verify(commandGateway).sendAndWait(command.capture());
        assertThat(((GenerateReceiptBatchCommand) command.getValue()).donors()).hasSize(2);
    }

    @Test
    void generateFromUploadShouldDetectCharsetAndParseDonorPart() throws Exception {
        when(commandGateway.<ReceiptGenerationResult>sendAndWait(any()))
                .thenReturn(new ReceiptGenerationResult(receipt, StrategyTier.BARE, false));
        byte[] template = "\uFEFFDear {First Name}, merci pour votre don généreux.".getBytes(StandardCharsets.UTF_8);

        mockMvc.perform(multipart("/receipts/upload")
                        .file(new MockMultipartFile("template", "receipt.txt", "text/plain", template))
                        .file(new MockMultipartFile("donor", "", "text/plain",
                                "{\"First Name\": \"Jane\", \"Last Name\": \"Doe\"}".getBytes(StandardCharsets.UTF_8))))
                .andExpect(status().isOk())
                .andExpect(header().string("X-Receipt-Tier", "BARE"));

        ArgumentCaptor<Object> command = ArgumentCaptor.forClass(Object.class);
        verify(commandGateway).sendAndWait(command.capture());
        GenerateReceiptCommand sent = (GenerateReceiptCommand) command.getValue();
        assertThat(sent.template()).isEqualTo("Dear {First Name}, merci pour votre don généreux.");
        assertThat(sent.donor().lastName()).isEqualTo("Doe");
    }
}

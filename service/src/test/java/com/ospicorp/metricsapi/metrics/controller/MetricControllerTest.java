package com.ospicorp.metricsapi.metrics.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.allOf;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.endsWith;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.ospicorp.metricsapi.metrics.service.ReportExporter;
import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

@SpringBootTest
@AutoConfigureMockMvc
class MetricControllerTest {

  private static final String HEADER = "metricId;dateTime;aggDay;aggMonth;aggYear\n";

  @Autowired
  private MockMvc mockMvc;

  @Test
  void importThenAggregateMonthly() throws Exception {
    mockMvc.perform(multipart("/v1/metrics/import").file(metricFile(HEADER
            + "7;01/01/2024 10:00;10;1;2024\n"
            + "7;15/01/2024 10:00;25;1;2024\n"
            + "7;2024-13-40 10:00;5;1;2024\n")))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.rows_read").value(3))
        .andExpect(jsonPath("$.records_written").value(2))
        .andExpect(jsonPath("$.rows_discarded").value(1));

    mockMvc.perform(get("/v1/metrics/aggregate")
            .param("metricId", "7")
            .param("aggType", "month")
            .param("dateInitial", "2024-01-01")
            .param("finalDate", "2024-01-31"))
        .andExpect(status().isOk())
        .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
        .andExpect(jsonPath("$", hasSize(1)))
        .andExpect(jsonPath("$[0].date").value("2024-01-01"))
        .andExpect(jsonPath("$[0].value").value(35));
  }

  @Test
  void aggregateAsCsvByFormatParameter() throws Exception {
    importFile(HEADER
        + "8;01/03/2024 09:00;4;3;2024\n"
        + "8;01/03/2024 18:00;6;3;2024\n"
        + "8;02/03/2024 09:00;1;3;2024\n");

    mockMvc.perform(get("/v1/metrics/aggregate")
            .param("metricId", "8")
            .param("aggType", "DAY")
            .param("dateInitial", "2024-03-01")
            .param("finalDate", "2024-03-02")
            .param("format", "csv"))
        .andExpect(status().isOk())
        .andExpect(content().contentTypeCompatibleWith("text/csv"))
        .andExpect(content().string("date,value\n2024-03-01,10\n2024-03-02,1\n"));
  }

  @Test
  void aggregateAsCsvByAcceptHeader() throws Exception {
    importFile(HEADER + "9;10/05/2023 12:00;3;5;2023\n");

    mockMvc.perform(get("/v1/metrics/aggregate")
            .param("metricId", "9")
            .param("aggType", "year")
            .param("dateInitial", "2023-01-01")
            .param("finalDate", "2023-12-31")
            .header(HttpHeaders.ACCEPT, "text/csv"))
        .andExpect(status().isOk())
        .andExpect(content().contentTypeCompatibleWith("text/csv"))
        .andExpect(content().string(containsString("2023-01-01,3")));
  }

  @Test
  void invalidMetricIdIsRejected() throws Exception {
    mockMvc.perform(get("/v1/metrics/aggregate")
            .param("metricId", "0")
            .param("aggType", "DAY")
            .param("dateInitial", "2024-01-01")
            .param("finalDate", "2024-01-31"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.errorCode").value(2002))
        .andExpect(jsonPath("$.parameter").value("metricId"))
        .andExpect(jsonPath("$.moreInfo").value(containsString("/2002")));
  }

  @Test
  void unknownAggregationTypeIsRejected() throws Exception {
    mockMvc.perform(get("/v1/metrics/aggregate")
            .param("metricId", "7")
            .param("aggType", "WEEK")
            .param("dateInitial", "2024-01-01")
            .param("finalDate", "2024-01-31"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.errorCode").value(2003));
  }

  @Test
  void reversedDateRangeIsRejected() throws Exception {
    mockMvc.perform(get("/v1/metrics/aggregate")
            .param("metricId", "7")
            .param("aggType", "DAY")
            .param("dateInitial", "2024-02-01")
            .param("finalDate", "2024-01-01"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.errorCode").value(2004));
  }

  @Test
  void malformedDateIsBadRequestProblem() throws Exception {
    mockMvc.perform(get("/v1/metrics/aggregate")
            .param("metricId", "7")
            .param("aggType", "DAY")
            .param("dateInitial", "01/01/2024")
            .param("finalDate", "2024-01-31"))
        .andExpect(status().isBadRequest())
        .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_PROBLEM_JSON))
        .andExpect(jsonPath("$.status").value(400));
  }

  @Test
  void unsupportedFormatIsBadRequest() throws Exception {
    mockMvc.perform(get("/v1/metrics/aggregate")
            .param("metricId", "7")
            .param("aggType", "DAY")
            .param("dateInitial", "2024-01-01")
            .param("finalDate", "2024-01-31")
            .param("format", "xml"))
        .andExpect(status().isBadRequest());
  }

  @Test
  void missingParameterIsBadRequest() throws Exception {
    mockMvc.perform(get("/v1/metrics/aggregate")
            .param("metricId", "7")
            .param("dateInitial", "2024-01-01")
            .param("finalDate", "2024-01-31"))
        .andExpect(status().isBadRequest());
  }

  @Test
  void emptyRangeIsNotFound() throws Exception {
    mockMvc.perform(get("/v1/metrics/aggregate")
            .param("metricId", "999")
            .param("aggType", "DAY")
            .param("dateInitial", "2024-01-01")
            .param("finalDate", "2024-01-31"))
        .andExpect(status().isNotFound())
        .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_PROBLEM_JSON))
        .andExpect(jsonPath("$.status").value(404))
        .andExpect(jsonPath("$.path").value("/v1/metrics/aggregate"));
  }

  @Test
  void importWithoutFileIsRejected() throws Exception {
    mockMvc.perform(multipart("/v1/metrics/import"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.errorCode").value(2001));
  }

  @Test
  void importWithEmptyFileIsRejected() throws Exception {
    mockMvc.perform(multipart("/v1/metrics/import")
            .file(new MockMultipartFile("file", "empty.csv", "text/csv", new byte[0])))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.errorCode").value(2001));
  }

  @Test
  void importRequiresMultipartBody() throws Exception {
    mockMvc.perform(post("/v1/metrics/import")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{}"))
        .andExpect(status().isUnsupportedMediaType());
  }

  @Test
  void reportIsDownloadedAsWorkbookAttachment() throws Exception {
    importFile(HEADER
        + "21;20/06/2024 10:00;7;6;2024\n"
        + "21;19/06/2024 10:00;3;6;2024\n");

    MvcResult result = mockMvc.perform(get("/v1/metrics/report")
            .param("metricId", "21")
            .param("dateInitial", "2024-06-01")
            .param("finalDate", "2024-06-30"))
        .andExpect(status().isOk())
        .andExpect(content().contentType(ReportExporter.CONTENT_TYPE))
        .andExpect(header().string(HttpHeaders.CONTENT_DISPOSITION, allOf(
            startsWith("attachment; filename=\"metric-report-21-"),
            endsWith(".xlsx\""))))
        .andReturn();

    byte[] body = result.getResponse().getContentAsByteArray();
    try (XSSFWorkbook workbook = new XSSFWorkbook(new ByteArrayInputStream(body))) {
      Sheet sheet = workbook.getSheet("Relatório de Métricas");
      assertThat(sheet.getRow(0).getCell(0).getStringCellValue()).isEqualTo("MetricId");
      assertThat(sheet.getLastRowNum()).isEqualTo(2);
      assertThat(sheet.getRow(1).getCell(1).getStringCellValue()).isEqualTo("19/06/2024");
      assertThat(sheet.getRow(1).getCell(2).getNumericCellValue()).isEqualTo(3);
      assertThat(sheet.getRow(2).getCell(1).getStringCellValue()).isEqualTo("20/06/2024");
      assertThat(sheet.getRow(2).getCell(2).getNumericCellValue()).isEqualTo(7);
      assertThat(sheet.getRow(2).getCell(4).getStringCellValue()).isEqualTo("24");
    }
  }

  @Test
  void reportForEmptyRangeIsNotFound() throws Exception {
    mockMvc.perform(get("/v1/metrics/report")
            .param("metricId", "998")
            .param("dateInitial", "2024-06-01")
            .param("finalDate", "2024-06-30"))
        .andExpect(status().isNotFound());
  }

  private void importFile(String content) throws Exception {
    mockMvc.perform(multipart("/v1/metrics/import").file(metricFile(content)))
        .andExpect(status().isOk());
  }

  private static MockMultipartFile metricFile(String content) {
    return new MockMultipartFile("file", "metrics.csv", "text/csv",
        content.getBytes(StandardCharsets.UTF_8));
  }
}

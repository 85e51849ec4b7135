package com.bit.ledger.api;

import com.bit.ledger.config.LedgerConfig;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@Slf4j
@SpringBootTest
@AutoConfigureMockMvc
public class LedgerApiTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private LedgerConfig ledgerConfig;

    private static String unique(String prefix) {
        return prefix + "-" + UUID.randomUUID().toString().substring(0, 8);
    }

    private void createHierarchy(String dept, String cls, String student, String roll) throws Exception {
        mockMvc.perform(post("/api/departments").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"id\":\"" + dept + "\",\"name\":\"Computer Science\",\"code\":\"CS\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.code").value(201))
                .andExpect(jsonPath("$.data.chainLength").value(1));

        mockMvc.perform(post("/api/classes").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"id\":\"" + cls + "\",\"name\":\"Data Structures\",\"departmentId\":\"" + dept + "\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.data.departmentId").value(dept));

        mockMvc.perform(post("/api/students").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"id\":\"" + student + "\",\"name\":\"Alice\",\"rollNumber\":\"" + roll
                                + "\",\"classId\":\"" + cls + "\",\"departmentId\":\"" + dept + "\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.data.classId").value(cls));
    }

    @Test
    void configBoundFromTestProfile() {
        assertEquals(1, ledgerConfig.getDifficulty());
        assertTrue(ledgerConfig.isMemoryStorage(), "测试环境使用内存存储");
    }

    @Test
    void markAttendanceAndValidate() throws Exception {
        String dept = unique("dept");
        String cls = unique("class");
        String student = unique("student");
        createHierarchy(dept, cls, student, unique("roll"));

        String body = "{\"studentId\":\"" + student + "\",\"status\":\"Present\",\"date\":\"2024-11-16\"}";
        mockMvc.perform(post("/api/attendance/mark").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.data.blockIndex").value(1))
                .andExpect(jsonPath("$.data.attendance.status").value("Present"));

        mockMvc.perform(post("/api/attendance/mark").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.message", containsString("already marked")));

        mockMvc.perform(get("/api/students/" + student + "/validate"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.valid").value(true))
                .andExpect(jsonPath("$.data.state").value("VALID"));

        mockMvc.perform(get("/api/validate/class/" + cls))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.valid").value(true));

        mockMvc.perform(get("/api/attendance/class/" + cls).param("date", "2024-11-16"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.summary.present").value(1))
                .andExpect(jsonPath("$.data.records", hasSize(1)));
    }

    @Test
    void updateAppendsBlock() throws Exception {
        String dept = unique("dept");
        createHierarchy(dept, unique("class"), unique("student"), unique("roll"));

        mockMvc.perform(put("/api/departments/" + dept).contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Computing\"}"))
                .andExpect(status().isOk());

        mockMvc.perform(get("/api/departments/" + dept))
                .andExpect(jsonPath("$.data.name").value("Computing"))
                .andExpect(jsonPath("$.data.chainLength").value(2));

        mockMvc.perform(get("/api/departments/" + dept + "/blocks/9"))
                .andExpect(status().isNotFound());
    }

    @Test
    void errorsMapToStatusCodes() throws Exception {
        mockMvc.perform(get("/api/students/no-such-student"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value(404));

        mockMvc.perform(post("/api/classes").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Orphan\",\"departmentId\":\"no-such-dept\"}"))
                .andExpect(status().isNotFound());

        mockMvc.perform(get("/api/students/search").param("q", " "))
                .andExpect(status().isBadRequest());

        mockMvc.perform(get("/api/validate/planet/x"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void systemValidation() throws Exception {
        createHierarchy(unique("dept"), unique("class"), unique("student"), unique("roll"));

        mockMvc.perform(get("/api/validate/system"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.valid").value(true));
    }
}

package com.dnobretech.teialigner;

import com.dnobretech.teialigner.align.Aligner;
import com.dnobretech.teialigner.service.TeiAlignmentService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class TeiAlignerApplicationTests {

    @Autowired
    private TeiAlignmentService service;

    @Autowired
    @Qualifier("lengthAligner")
    private Aligner lengthAligner;

    @Test
    void contextLoads() {
        assertThat(service).isNotNull();
        assertThat(lengthAligner).isNotNull();
    }
}

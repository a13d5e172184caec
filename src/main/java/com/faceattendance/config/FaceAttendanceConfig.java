package com.faceattendance.config;

import com.faceattendance.matching.DescriptorCodec;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestTemplate;

@Configuration
@EnableConfigurationProperties(FaceAttendanceProperties.class)
public class FaceAttendanceConfig {

    public static final String FACE_TASK_EXECUTOR = "faceTaskExecutor";
    public static final String ATTENDANCE_JOB_EXECUTOR = "attendanceJobExecutor";

    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder, FaceAttendanceProperties props) {
        // read timeout doubles as the per-call extraction deadline
        return builder
                .setConnectTimeout(props.getExtractor().getConnectTimeout())
                .setReadTimeout(props.getExtractor().getTimeout())
                .build();
    }

    @Bean
    public DescriptorCodec descriptorCodec(FaceAttendanceProperties props) {
        return new DescriptorCodec(props.getDescriptorLength());
    }

    /** Per-image downloads and extractions. Tasks here never wait on each other. */
    @Bean(name = FACE_TASK_EXECUTOR)
    public ThreadPoolTaskExecutor faceTaskExecutor(FaceAttendanceProperties props) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getExecutor().getTaskPoolSize());
        executor.setMaxPoolSize(props.getExecutor().getTaskPoolSize());
        executor.setThreadNamePrefix("face-task-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    /** Background reconciliations submitted through the by-url endpoint. */
    @Bean(name = ATTENDANCE_JOB_EXECUTOR)
    public ThreadPoolTaskExecutor attendanceJobExecutor(FaceAttendanceProperties props) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getExecutor().getJobPoolSize());
        executor.setMaxPoolSize(props.getExecutor().getJobPoolSize());
        executor.setQueueCapacity(props.getExecutor().getJobQueueCapacity());
        executor.setThreadNamePrefix("attendance-job-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        return executor;
    }
}

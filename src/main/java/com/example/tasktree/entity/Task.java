package com.example.tasktree.entity;

import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.ColumnDefault;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "tasks")
@Data
public class Task {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String title;

    private String description;

    @Column(nullable = false)
    @ColumnDefault("false")
    private boolean status;

    private LocalDateTime updated = LocalDateTime.now();

    // id of the owning task, null for roots
    private Long parent;

    // ordered ids of direct children, mirrored by each child's parent column
    @JdbcTypeCode(SqlTypes.ARRAY)
    private List<Long> childs = new ArrayList<>();
}

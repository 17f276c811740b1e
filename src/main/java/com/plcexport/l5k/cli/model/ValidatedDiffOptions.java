package com.plcexport.l5k.cli.model;

import java.nio.charset.Charset;
import java.util.List;

import com.plcexport.l5k.model.EntityKey;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class ValidatedDiffOptions {
    Charset charset;
    List<EntityKey> acceptAdded;
    List<EntityKey> acceptRemoved;
}

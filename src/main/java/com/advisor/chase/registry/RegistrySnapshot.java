package com.advisor.chase.registry;

import com.advisor.chase.model.Activity;
import com.advisor.chase.model.ChaseItem;

import java.util.List;

public record RegistrySnapshot(List<ChaseItem> items, List<Activity> activities) {}
